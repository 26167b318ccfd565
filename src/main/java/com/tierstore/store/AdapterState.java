package com.tierstore.store;

public enum AdapterState {
    UNBOUND,
    BINDING,
    CREATING,
    BOUND,
    CLOSED
}
