package io.github.drompincen.cronsync.app.controller;

public record EnabledRequest(boolean enabled) {}
