package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.pipeline.model.Recipient;

import java.util.List;

/**
 * Read-only view of subscribers owned by account management.
 */
public interface RecipientDirectory {

    List<Recipient> listEligibleRecipients();
}
