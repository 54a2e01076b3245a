package com.mogu.similarity.interaction;

public record UserItemInteraction(String userId, String itemId, double weight) {
}
