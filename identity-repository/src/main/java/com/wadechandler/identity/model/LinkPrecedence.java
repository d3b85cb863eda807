package com.wadechandler.identity.model;

public enum LinkPrecedence {
    PRIMARY,
    SECONDARY
}
