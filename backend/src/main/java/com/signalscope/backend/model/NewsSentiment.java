package com.signalscope.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Externally supplied news summary: label plus a 0-100 score.
 */
@Value
@Builder
@AllArgsConstructor
public class NewsSentiment {
    @Builder.Default
    Sentiment sentiment = Sentiment.NEUTRAL;
    @Builder.Default
    int score = 50;
    @Builder.Default
    ImpactLevel impactLevel = ImpactLevel.LOW;
    int itemCount;

    public static NewsSentiment none() {
        return NewsSentiment.builder().build();
    }
}
