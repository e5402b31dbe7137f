package com.hanyahunya.sandbox.domain.model;

public enum SecurityLevel {
    LOW, MEDIUM, HIGH
}
