package com.multiangle.api;

public record FeedbackRequest(String feedback) {
}
