package com.scholary.video.splitter.api;

/** Error body returned by the API. */
public record ApiError(String error) {}
