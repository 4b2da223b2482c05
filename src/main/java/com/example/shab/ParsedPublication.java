package com.example.shab;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical in-memory form of one SHAB publication, produced by {@link ShabParser}
 * and handed to {@link DatabaseManager#upsert(ParsedPublication)}.
 */
@Data
@NoArgsConstructor
public class ParsedPublication {
    public static final List<String> LANGUAGES = List.of("de", "fr", "it", "en");

    private String id;
    private String rubric;
    private String subRubric;
    private LocalDate publicationDate;
    private LocalDate expirationDate;
    /** Always holds exactly the keys de, fr, it, en; a missing language is "". */
    private Map<String, String> title = emptyTitle();
    private String language;
    private String canton;
    private RegistrationOffice registrationOffice;
    private List<Auction> auctions = new ArrayList<>();
    private List<Debtor> debtors = new ArrayList<>();
    private List<Contact> contacts = new ArrayList<>();

    public static Map<String, String> emptyTitle() {
        Map<String, String> title = new LinkedHashMap<>();
        for (String lang : LANGUAGES) {
            title.put(lang, "");
        }
        return title;
    }
}
