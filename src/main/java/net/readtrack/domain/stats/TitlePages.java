package net.readtrack.domain.stats;

public record TitlePages(String title, int pageCount) {
}
