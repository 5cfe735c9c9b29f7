package io.github.drompincen.cronsync.app.controller;

/** Body of {@code PUT /api/cron/selection}; a null id clears the selection. */
public record SelectionRequest(String jobId) {}
