package com.fintech.subscriptions.dto;

import lombok.Value;

@Value
public class SubscriptionCounts {

    long total;

    long active;
}
