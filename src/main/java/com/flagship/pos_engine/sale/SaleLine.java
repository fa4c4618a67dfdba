package com.flagship.pos_engine.sale;

import lombok.Value;

import java.util.UUID;

/**
 * One requested line of a checkout.
 */
@Value(staticConstructor = "of")
public class SaleLine {
    UUID stockItemId;
    int quantity;
}
