package com.wadechandler.identity.controller;

import com.wadechandler.identity.model.dto.ConsolidatedContact;
import com.wadechandler.identity.model.dto.IdentifyRequest;
import com.wadechandler.identity.model.dto.IdentifyResponse;
import com.wadechandler.identity.reconcile.Reconciler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/identify")
@RequiredArgsConstructor
@Slf4j
public class IdentifyController {

    private final Reconciler reconciler;

    @PostMapping
    public ResponseEntity<IdentifyResponse> identify(@Valid @RequestBody IdentifyRequest request) {
        ConsolidatedContact contact = reconciler.reconcile(request.email(), request.phoneNumber());
        log.info("Identified primary {} ({} secondaries)",
                contact.primaryContactId(), contact.secondaryContactIds().size());
        return ResponseEntity.ok(new IdentifyResponse(contact));
    }
}
