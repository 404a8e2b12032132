package com.example.dmpipeline.model;

public record PostDeliveryCount(String postId, int deliveryCount) {}
