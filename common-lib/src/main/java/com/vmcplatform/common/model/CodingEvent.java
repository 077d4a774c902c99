package com.vmcplatform.common.model;

import java.time.LocalDateTime;

public record CodingEvent(String coder, long utteranceId, LocalDateTime codedAt) {}
