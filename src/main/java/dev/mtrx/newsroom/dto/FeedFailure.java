package dev.mtrx.newsroom.dto;

public record FeedFailure(Long feedId, String detail) {
}
