package com.flagship.reconciliation.matching;

import java.util.Optional;

/**
 * Maps free text (bank description, payee, employee name) to a canonical name.
 * Vendor and employee dictionaries live outside the engine and plug in here.
 */
public interface AliasResolver {

    Optional<String> canonicalName(String text);
}
