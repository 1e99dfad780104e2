package com.williamcallahan.statuteindex.web;

/**
 * Request body for the citation endpoints.
 *
 * @param citation citation text; blank text is answered as an invalid "Empty citation"
 * @param format output convention for formatting ({@code full}, {@code short}, {@code pinpoint}); blank means full
 */
public record CitationRequest(String citation, String format) {}
