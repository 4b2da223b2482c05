package com.example.shab;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Normalises a SHAB debt-enforcement auction (SB01) document into a
 * {@link ParsedPublication}.
 * <p>
 * Mandatory: publication date, canton, at least one title language and the date of every
 * auction. Everything else is optional; a malformed optional value is logged and dropped
 * instead of failing the publication.
 */
@Slf4j
public class ShabParser {
    private final ContactLookup contactLookup;

    public ShabParser() {
        this(ContactLookup.NONE);
    }

    public ShabParser(ContactLookup contactLookup) {
        this.contactLookup = contactLookup;
    }

    public ParsedPublication parse(String xml, String publicationId) throws ParseException {
        Document doc = XmlSupport.parseDocument(xml, publicationId);
        Element root = doc.getDocumentElement();
        Element meta = XmlSupport.child(root, "meta");

        ParsedPublication publication = new ParsedPublication();
        publication.setId(resolveId(publicationId, scalar(root, meta, "id")));
        String id = publication.getId();

        publication.setRubric(scalar(root, meta, "rubric"));
        publication.setSubRubric(scalar(root, meta, "subRubric"));
        publication.setLanguage(lower(orDefault(scalar(root, meta, "language"), "de")));

        publication.setPublicationDate(requiredDate(id, "publicationDate", scalar(root, meta, "publicationDate")));
        publication.setExpirationDate(optionalDate(id, "expirationDate", scalar(root, meta, "expirationDate")));

        String canton = orDefault(scalar(root, meta, "cantons"), scalar(root, meta, "canton"));
        if (canton == null) {
            throw new ParseException(id, "Missing mandatory field canton");
        }
        publication.setCanton(firstCanton(canton));

        publication.setTitle(parseTitle(id, firstOf(root, meta, "title"), publication.getLanguage()));

        Element officeElement = firstOf(root, meta, "registrationOffice");
        publication.setRegistrationOffice(parseRegistrationOffice(officeElement));

        publication.setAuctions(parseAuctions(id, root));
        publication.setDebtors(parseDebtors(id, root));
        publication.setContacts(ContactMerger.resolve(parseContacts(publication.getRegistrationOffice(), root), contactLookup));

        log.info("Parsed publication {}: {} auction(s), {} debtor(s), {} contact(s)", id,
                publication.getAuctions().size(), publication.getDebtors().size(), publication.getContacts().size());
        return publication;
    }

    private String resolveId(String requested, String fromXml) throws ParseException {
        if (XmlSupport.isBlank(requested)) {
            if (fromXml == null) {
                throw new ParseException(null, "Publication has no id");
            }
            return fromXml;
        }
        if (fromXml != null && !fromXml.equalsIgnoreCase(requested.trim())) {
            log.warn("ID mismatch: requested {}, document says {}; keeping the requested id", requested, fromXml);
        }
        return requested.trim();
    }

    // Publication-level values live under <meta> in current exports and directly under the
    // root in older ones.
    private static Element firstOf(Element root, Element meta, String name) {
        Element found = XmlSupport.child(meta, name);
        return found != null ? found : XmlSupport.child(root, name);
    }

    private static String scalar(Element root, Element meta, String name) {
        return XmlSupport.textOf(firstOf(root, meta, name));
    }

    private static String firstCanton(String cantons) {
        String first = cantons.split("[,;\\s]+")[0];
        return first.toUpperCase(Locale.ROOT);
    }

    Map<String, String> parseTitle(String id, Element titleElement, String language) throws ParseException {
        Map<String, String> title = ParsedPublication.emptyTitle();
        if (titleElement == null) {
            throw new ParseException(id, "Missing mandatory field title");
        }
        boolean any = false;
        for (String lang : ParsedPublication.LANGUAGES) {
            String value = XmlSupport.text(titleElement, lang);
            if (value != null) {
                title.put(lang, value);
                any = true;
            }
        }
        if (!any) {
            // unlocalised title: file it under the publication language
            String plain = XmlSupport.textOf(titleElement);
            if (plain != null && title.containsKey(language)) {
                title.put(language, plain);
                any = true;
            }
        }
        if (!any) {
            throw new ParseException(id, "Missing mandatory field title: no language variant present");
        }
        return title;
    }

    RegistrationOffice parseRegistrationOffice(Element element) {
        if (element == null) {
            return null;
        }
        RegistrationOffice office = new RegistrationOffice();
        office.setId(XmlSupport.text(element, "id"));
        office.setDisplayName(XmlSupport.text(element, "displayName"));
        office.setStreet(XmlSupport.text(element, "street"));
        office.setStreetNumber(XmlSupport.text(element, "streetNumber"));
        office.setSwissZipCode(XmlSupport.text(element, "swissZipCode"));
        office.setTown(XmlSupport.text(element, "town"));
        office.setContainsPostOfficeBox("true".equalsIgnoreCase(XmlSupport.text(element, "containsPostOfficeBox")));
        Element pob = XmlSupport.child(element, "postOfficeBox");
        if (pob != null) {
            office.setPostOfficeBox(new PostOfficeBox(
                    XmlSupport.text(pob, "number"), XmlSupport.text(pob, "zipCode"), XmlSupport.text(pob, "town")));
        }
        return office;
    }

    List<Auction> parseAuctions(String id, Element root) throws ParseException {
        List<Auction> auctions = new ArrayList<>();
        List<Element> auctionElements = XmlSupport.descendants(root, "auction");
        for (int i = 0; i < auctionElements.size(); i++) {
            auctions.add(parseAuction(id, auctionElements.get(i), i));
        }

        // objects listed outside any <auction> belong to the first auction
        List<AuctionObject> orphans = new ArrayList<>();
        for (Element objects : XmlSupport.descendants(root, "auctionObjects")) {
            if (!insideAuction(objects)) {
                addObject(orphans, objects);
            }
        }
        if (!orphans.isEmpty()) {
            if (auctions.isEmpty()) {
                log.warn("Publication {} lists {} auction object(s) but no auction; objects dropped", id, orphans.size());
            } else {
                auctions.get(0).getObjects().addAll(orphans);
            }
        }
        return auctions;
    }

    private static boolean insideAuction(Element element) {
        for (Node p = element.getParentNode(); p != null; p = p.getParentNode()) {
            if (p.getNodeType() == Node.ELEMENT_NODE && "auction".equals(XmlSupport.localName(p))) {
                return true;
            }
        }
        return false;
    }

    private Auction parseAuction(String id, Element element, int index) throws ParseException {
        Auction auction = new Auction();
        String auctionId = XmlSupport.text(element, "id");
        auction.setId(auctionId != null ? auctionId : derivedId(id, "auction", index));

        String date = XmlSupport.text(element, "date");
        if (date == null) {
            throw new ParseException(id, "Auction " + (index + 1) + " has no date");
        }
        auction.setDate(requiredDate(id, "auction date", date));
        auction.setTime(optionalTime(id, XmlSupport.text(element, "time")));
        auction.setLocation(orDefault(XmlSupport.text(element, "location"), Auction.UNKNOWN_LOCATION));
        auction.setCirculation(parseDeadline(id, XmlSupport.child(element, "circulation")));
        auction.setRegistration(parseDeadline(id, XmlSupport.child(element, "registration")));

        for (Element objects : XmlSupport.descendants(element, "auctionObjects")) {
            addObject(auction.getObjects(), objects);
        }
        return auction;
    }

    private static void addObject(List<AuctionObject> target, Element objects) {
        String markup = XmlSupport.innerMarkup(objects);
        if (markup != null) {
            target.add(new AuctionObject(markup));
        }
    }

    private Deadline parseDeadline(String id, Element element) {
        if (element == null) {
            return null;
        }
        return new Deadline(
                optionalDate(id, XmlSupport.localName(element) + ".entryDeadline", XmlSupport.text(element, "entryDeadline")),
                XmlSupport.text(element, "commentEntryDeadline"));
    }

    List<Debtor> parseDebtors(String id, Element root) {
        List<Debtor> debtors = new ArrayList<>();
        for (Element element : XmlSupport.descendants(root, "debtor")) {
            Debtor debtor = isCompany(element) ? parseCompany(id, element) : parsePerson(id, element);
            if (XmlSupport.isBlank(debtor.getName())) {
                log.warn("Publication {}: skipping {} debtor without name", id, debtor.getType().getCode());
                continue;
            }
            debtors.add(debtor);
        }
        return debtors;
    }

    private static boolean isCompany(Element debtor) {
        if (XmlSupport.child(debtor, "company") != null) {
            return true;
        }
        if (XmlSupport.child(debtor, "person") != null) {
            return false;
        }
        return "company".equalsIgnoreCase(XmlSupport.text(debtor, "selectType"))
                || XmlSupport.child(debtor, "legalForm") != null;
    }

    private PersonDebtor parsePerson(String id, Element debtor) {
        Element person = orSelf(XmlSupport.child(debtor, "person"), debtor);
        PersonDebtor result = new PersonDebtor();
        result.setName(XmlSupport.text(person, "name"));
        result.setPrename(XmlSupport.text(person, "prename"));
        result.setDateOfBirth(optionalDate(id, "dateOfBirth", XmlSupport.text(person, "dateOfBirth")));
        result.setCountryOfOrigin(parseCountry(XmlSupport.child(person, "countryOfOrigin")));

        Element swiss = XmlSupport.child(person, "addressSwitzerland");
        Element foreign = XmlSupport.child(person, "addressForeign");
        Debtor.ResidenceType residence = Debtor.ResidenceType.fromCode(
                XmlSupport.text(XmlSupport.child(person, "residence"), "selectType"));
        if (residence == null) {
            residence = swiss != null ? Debtor.ResidenceType.SWITZERLAND
                    : foreign != null ? Debtor.ResidenceType.FOREIGN : null;
        }
        applyResidence(result, residence, swiss, foreign != null ? foreign : XmlSupport.child(person, "address"));
        return result;
    }

    private CompanyDebtor parseCompany(String id, Element debtor) {
        Element company = orSelf(XmlSupport.child(debtor, "company"), debtor);
        CompanyDebtor result = new CompanyDebtor();
        result.setName(XmlSupport.text(company, "name"));
        result.setLegalForm(XmlSupport.text(company, "legalForm"));
        result.setUid(XmlSupport.text(company, "uid"));
        result.setCanton(XmlSupport.text(company, "canton"));

        Element address = XmlSupport.child(company, "address");
        Element swiss = XmlSupport.child(company, "addressSwitzerland");
        Element foreign = XmlSupport.child(company, "addressForeign");
        if (swiss == null && address != null && XmlSupport.text(address, "swissZipCode") != null) {
            swiss = address;
        }
        if (foreign == null && swiss == null) {
            foreign = address;
        }
        Debtor.ResidenceType residence = Debtor.ResidenceType.fromCode(
                XmlSupport.text(XmlSupport.child(company, "residence"), "selectType"));
        if (residence == null) {
            residence = swiss != null ? Debtor.ResidenceType.SWITZERLAND
                    : foreign != null ? Debtor.ResidenceType.FOREIGN : null;
        }
        applyResidence(result, residence, swiss, foreign);
        if (result.getDisplayAddress() == null && address != null) {
            result.setDisplayAddress(XmlSupport.text(address, "addressLine1"));
        }
        log.debug("Publication {}: company debtor {} ({})", id, result.getName(), result.getLegalForm());
        return result;
    }

    private static void applyResidence(Debtor debtor, Debtor.ResidenceType residence, Element swiss, Element foreign) {
        debtor.setResidence(residence);
        if (residence == Debtor.ResidenceType.SWITZERLAND && swiss != null) {
            SwissAddress address = new SwissAddress(
                    XmlSupport.text(swiss, "street"),
                    XmlSupport.text(swiss, "houseNumber"),
                    XmlSupport.text(swiss, "swissZipCode"),
                    XmlSupport.text(swiss, "town"));
            debtor.setSwissAddress(address);
            debtor.setDisplayAddress(address.streetLine());
            debtor.setCity(address.getTown());
            debtor.setPostalCode(address.getSwissZipCode());
        } else {
            // foreign residents only get the display triple, never a structured Swiss address
            Element flat = foreign != null ? foreign : swiss;
            if (flat == null) {
                return;
            }
            String line = XmlSupport.joinNonBlank(" ", XmlSupport.text(flat, "street"), XmlSupport.text(flat, "houseNumber"));
            debtor.setDisplayAddress(line != null ? line : XmlSupport.text(flat, "addressLine1"));
            debtor.setCity(XmlSupport.text(flat, "town"));
            String zip = XmlSupport.text(flat, "foreignZipCode");
            debtor.setPostalCode(zip != null ? zip : orDefault(XmlSupport.text(flat, "zipCode"), XmlSupport.text(flat, "swissZipCode")));
        }
    }

    private static Country parseCountry(Element element) {
        if (element == null) {
            return null;
        }
        Map<String, String> names = ParsedPublication.emptyTitle();
        Element name = XmlSupport.child(element, "name");
        for (String lang : ParsedPublication.LANGUAGES) {
            String value = XmlSupport.text(name, lang);
            if (value != null) {
                names.put(lang, value);
            }
        }
        return new Country(XmlSupport.text(element, "isoCode"), names);
    }

    List<Contact> parseContacts(RegistrationOffice office, Element root) {
        List<Contact> contacts = new ArrayList<>();
        if (office != null && (office.getId() != null || office.getDisplayName() != null)) {
            OfficeContact contact = new OfficeContact();
            contact.setOfficeId(office.getId());
            contact.setName(office.getDisplayName());
            contact.setAddress(XmlSupport.joinNonBlank(" ", office.getStreet(), office.getStreetNumber()));
            contact.setPostalCode(office.getSwissZipCode());
            contact.setCity(office.getTown());
            contact.setContainsPostOfficeBox(office.isContainsPostOfficeBox());
            contact.setPostOfficeBox(office.getPostOfficeBox());
            contacts.add(contact);
        }
        for (Element element : XmlSupport.descendants(root, "contact")) {
            Contact contact = parseContact(element);
            if (contact.getName() != null) {
                contacts.add(contact);
            }
        }
        return contacts;
    }

    private static Contact parseContact(Element element) {
        String type = orDefault(XmlSupport.text(element, "contactType"), XmlSupport.text(element, "selectType"));
        String officeId = orDefault(XmlSupport.text(element, "officeId"), XmlSupport.text(element, "id"));
        Contact contact;
        if ("person".equalsIgnoreCase(type) || (type == null && officeId == null)) {
            contact = new PersonContact();
            contact.setName(orDefault(
                    XmlSupport.joinNonBlank(" ", XmlSupport.text(element, "prename"), XmlSupport.text(element, "name")),
                    XmlSupport.text(element, "displayName")));
        } else {
            OfficeContact office = new OfficeContact();
            office.setOfficeId(officeId);
            office.setName(orDefault(XmlSupport.text(element, "displayName"), XmlSupport.text(element, "name")));
            contact = office;
        }
        Element addressElement = XmlSupport.child(element, "address");
        boolean structured = XmlSupport.hasElementChildren(addressElement);
        Element parts = structured ? addressElement : element;
        String address = structured ? null : XmlSupport.textOf(addressElement);
        if (address == null) {
            address = XmlSupport.joinNonBlank(" ",
                    XmlSupport.text(parts, "street"),
                    orDefault(XmlSupport.text(parts, "houseNumber"), XmlSupport.text(parts, "streetNumber")));
        }
        contact.setAddress(address);
        contact.setPostalCode(firstNonNull(
                XmlSupport.text(element, "postalCode"), XmlSupport.text(element, "swissZipCode"),
                XmlSupport.text(parts, "swissZipCode"), XmlSupport.text(parts, "zipCode")));
        contact.setCity(firstNonNull(
                XmlSupport.text(element, "city"), XmlSupport.text(element, "town"), XmlSupport.text(parts, "town")));
        contact.setPhone(XmlSupport.text(element, "phone"));
        contact.setEmail(XmlSupport.text(element, "email"));
        String pob = XmlSupport.text(element, "containsPostOfficeBox");
        if (pob != null) {
            contact.setContainsPostOfficeBox(Boolean.parseBoolean(pob));
        }
        return contact;
    }

    private static LocalDate requiredDate(String id, String field, String value) throws ParseException {
        if (value == null) {
            throw new ParseException(id, "Missing mandatory field " + field);
        }
        try {
            return XmlSupport.parseDate(value);
        } catch (DateTimeParseException e) {
            throw new ParseException(id, "Invalid " + field + ": " + value, e);
        }
    }

    private static LocalDate optionalDate(String id, String field, String value) {
        try {
            return XmlSupport.parseDate(value);
        } catch (DateTimeParseException e) {
            log.warn("Publication {}: ignoring unparseable {} '{}'", id, field, value);
            return null;
        }
    }

    private static LocalTime optionalTime(String id, String value) {
        try {
            return XmlSupport.parseTime(value);
        } catch (DateTimeParseException e) {
            log.warn("Publication {}: ignoring unparseable auction time '{}'", id, value);
            return null;
        }
    }

    /** Stable across re-parses of the same document. */
    static String derivedId(String publicationId, String kind, int index) {
        return UUID.nameUUIDFromBytes((publicationId + ":" + kind + ":" + index).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static Element orSelf(Element candidate, Element self) {
        return candidate != null ? candidate : self;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
