package com.wadechandler.identity.reconcile;

import com.wadechandler.identity.model.Contact;
import com.wadechandler.identity.repository.ContactStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Finds every live contact sharing the incoming email or phone number, oldest first.
 */
@Component
@RequiredArgsConstructor
public class ContactMatcher {

    private final ContactStore contactStore;

    public List<Contact> match(String email, String phoneNumber) {
        return contactStore.findMatching(email, phoneNumber);
    }
}
