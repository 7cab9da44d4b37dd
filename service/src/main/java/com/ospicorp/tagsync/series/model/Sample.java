package com.ospicorp.tagsync.series.model;

import java.time.LocalDateTime;

public record Sample(LocalDateTime timestamp, double value) {}
