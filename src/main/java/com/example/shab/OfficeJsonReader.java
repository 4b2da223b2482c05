package com.example.shab;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads an office contact from the SHAB JSON API. Accepts a publication document carrying
 * it under meta.registrationOffice or registrationOffice, or a bare office object with a name.
 */
public class OfficeJsonReader {
    private final ObjectMapper mapper;

    public OfficeJsonReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<OfficeContact> read(byte[] json) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode office = root.path("meta").path("registrationOffice");
        if (!office.isObject()) {
            office = root.path("registrationOffice");
        }
        if (!office.isObject()) {
            // a bare office object; any other document has no office to offer
            if (firstText(root, "displayName", "name") == null) {
                return Optional.empty();
            }
            office = root;
        }

        OfficeContact contact = new OfficeContact();
        contact.setOfficeId(text(office, "id"));
        contact.setName(firstText(office, "displayName", "name"));
        contact.setAddress(XmlSupport.joinNonBlank(" ", text(office, "street"), text(office, "streetNumber")));
        contact.setPostalCode(firstText(office, "swissZipCode", "zipCode"));
        contact.setCity(text(office, "town"));
        contact.setPhone(firstText(office, "phone", "phoneNumber"));
        contact.setEmail(text(office, "email"));
        JsonNode flag = office.path("containsPostOfficeBox");
        if (flag.isBoolean()) {
            contact.setContainsPostOfficeBox(flag.asBoolean());
        }
        JsonNode pob = office.path("postOfficeBox");
        if (pob.isObject()) {
            contact.setPostOfficeBox(new PostOfficeBox(
                    text(pob, "number"), text(pob, "zipCode"), text(pob, "town")));
        }
        if (contact.getOfficeId() == null && contact.getName() == null) {
            return Optional.empty();
        }
        return Optional.of(contact);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String s = value.asText("");
        return s.isBlank() ? null : s.trim();
    }
}
