package com.example.shab;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges office contacts coming from the publication XML with the ones resolved from
 * the office JSON document. Pure functions: inputs are never modified.
 */
public final class ContactMerger {

    private ContactMerger() {
    }

    /**
     * Non-empty fields of {@code fromJson} win, except the office id, which keeps the XML
     * value whenever there is one. Either side may be null.
     */
    public static OfficeContact merge(OfficeContact fromXml, OfficeContact fromJson) {
        if (fromJson == null) {
            return fromXml == null ? null : fromXml.copy();
        }
        if (fromXml == null) {
            return fromJson.copy();
        }
        OfficeContact merged = fromXml.copy();
        // the XML office id is the lookup key and stays the back-reference
        merged.setOfficeId(prefer(fromXml.getOfficeId(), fromJson.getOfficeId()));
        merged.setName(prefer(fromJson.getName(), fromXml.getName()));
        merged.setAddress(prefer(fromJson.getAddress(), fromXml.getAddress()));
        merged.setPostalCode(prefer(fromJson.getPostalCode(), fromXml.getPostalCode()));
        merged.setCity(prefer(fromJson.getCity(), fromXml.getCity()));
        merged.setPhone(prefer(fromJson.getPhone(), fromXml.getPhone()));
        merged.setEmail(prefer(fromJson.getEmail(), fromXml.getEmail()));
        if (fromJson.getContainsPostOfficeBox() != null) {
            merged.setContainsPostOfficeBox(fromJson.getContainsPostOfficeBox());
        }
        if (fromJson.getPostOfficeBox() != null) {
            merged.setPostOfficeBox(fromJson.getPostOfficeBox());
        }
        return merged;
    }

    /**
     * Collapses office contacts sharing an office id into the first occurrence, filling its
     * blanks from later duplicates. Person contacts and offices without id pass through.
     * Source order is kept.
     */
    public static List<Contact> dedupeOffices(List<Contact> contacts) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        List<Contact> result = new ArrayList<>();
        for (Contact contact : contacts) {
            String officeId = contact.getOfficeId();
            if (contact instanceof OfficeContact && officeId != null) {
                Integer pos = positions.get(officeId);
                if (pos != null) {
                    OfficeContact first = (OfficeContact) result.get(pos);
                    result.set(pos, merge((OfficeContact) contact, first));
                    continue;
                }
                positions.put(officeId, result.size());
            }
            result.add(contact);
        }
        return result;
    }

    /**
     * Dedupes, then enriches every office contact through the lookup. A failed or empty
     * lookup leaves the XML contact untouched.
     */
    public static List<Contact> resolve(List<Contact> xmlContacts, ContactLookup lookup) {
        List<Contact> result = new ArrayList<>();
        for (Contact contact : dedupeOffices(xmlContacts)) {
            if (contact instanceof OfficeContact && contact.getOfficeId() != null) {
                OfficeContact office = (OfficeContact) contact;
                OfficeContact fromJson = lookup.lookup(office.getOfficeId()).orElse(null);
                result.add(merge(office, fromJson));
            } else {
                result.add(contact);
            }
        }
        return result;
    }

    private static String prefer(String primary, String fallback) {
        return primary != null && !primary.isBlank() ? primary : fallback;
    }
}
