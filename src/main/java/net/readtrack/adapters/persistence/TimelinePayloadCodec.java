package net.readtrack.adapters.persistence;

import jakarta.annotation.Nullable;
import java.util.List;
import net.readtrack.domain.timeline.TimelineEventDetail;
import net.readtrack.domain.timeline.TimelinePayload;
import net.readtrack.domain.timeline.TimelineReadingData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Owns the JSON shape of the timeline payload columns.
 *
 * <p>No other component reads {@code details_json}, {@code genres_json} or
 * {@code reading_data_json} directly. Output is deterministic for equal payloads, which the
 * rebuild job relies on to detect unchanged rows.</p>
 */
@Component
public class TimelinePayloadCodec {

    private static final Logger log = LoggerFactory.getLogger(TimelinePayloadCodec.class);

    private static final TypeReference<List<TimelineEventDetail>> DETAILS_TYPE = new TypeReference<>() { };
    private static final TypeReference<List<String>> GENRES_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public TimelinePayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Column values for one payload.
     */
    public record EncodedPayload(String title,
                                 String detailsJson,
                                 String genresJson,
                                 @Nullable String readingDataJson) {
    }

    public EncodedPayload encode(TimelinePayload payload) {
        return new EncodedPayload(
            payload.title(),
            write(payload.details(), "details"),
            write(payload.genres(), "genres"),
            payload.readingData() == null ? null : write(payload.readingData(), "reading data")
        );
    }

    public TimelinePayload decode(String title,
                                  @Nullable String detailsJson,
                                  @Nullable String genresJson,
                                  @Nullable String readingDataJson) {
        List<TimelineEventDetail> details = isBlank(detailsJson) ? List.of() : read(detailsJson, DETAILS_TYPE, "details");
        List<String> genres = isBlank(genresJson) ? List.of() : read(genresJson, GENRES_TYPE, "genres");
        TimelineReadingData readingData = isBlank(readingDataJson)
            ? null
            : read(readingDataJson, TimelineReadingData.class, "reading data");
        return new TimelinePayload(title, details, genres, readingData);
    }

    private String write(Object value, String label) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to encode timeline event " + label, ex);
        }
    }

    private <T> T read(String json, TypeReference<T> type, String label) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JacksonException ex) {
            log.error("Failed to decode timeline event {}: {}", label, json, ex);
            throw new IllegalStateException("Stored timeline event " + label + " is invalid", ex);
        }
    }

    private <T> T read(String json, Class<T> type, String label) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JacksonException ex) {
            log.error("Failed to decode timeline event {}: {}", label, json, ex);
            throw new IllegalStateException("Stored timeline event " + label + " is invalid", ex);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
