package com.ogt.crm.model;

public enum WriteOutcome {
    CREATED,
    DUPLICATE
}
