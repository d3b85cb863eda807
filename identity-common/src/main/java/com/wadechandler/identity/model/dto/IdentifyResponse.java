package com.wadechandler.identity.model.dto;

public record IdentifyResponse(ConsolidatedContact contact) {}
