package com.narraflow.narraflow_backend.model.dto;

public record CursorMessage(double x, double y) {}
