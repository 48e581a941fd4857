package com.lottoharvest.domain.model;

/**
 * Decoded page text for one (round, tier, page) triple.
 */
public record FetchedDocument(Section section, int page, int statusCode, String text, String url) {
}
