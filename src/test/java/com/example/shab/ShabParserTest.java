package com.example.shab;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ShabParserTest {
    private final ShabParser parser = new ShabParser();

    @Test
    public void parsesBleinAuction() throws Exception {
        ParsedPublication p = parser.parse(Fixtures.blein(), Fixtures.BLEIN_ID);

        assertEquals(Fixtures.BLEIN_ID, p.getId());
        assertEquals("VS", p.getCanton());
        assertEquals("fr", p.getLanguage());
        assertEquals("SB01", p.getSubRubric());
        assertEquals(LocalDate.of(2025, 9, 5), p.getPublicationDate());
        assertEquals(LocalDate.of(2026, 9, 5), p.getExpirationDate());

        assertEquals(1, p.getAuctions().size());
        Auction auction = p.getAuctions().get(0);
        assertEquals("6c8521f9-55c9-4bca-99cf-f65fb72a9143", auction.getId());
        assertEquals(LocalDate.of(2025, 10, 23), auction.getDate());
        assertEquals(LocalTime.of(11, 0, 0), auction.getTime());
        assertEquals("au Café de la Place, Place du Cotterd 1, 1981 Vex", auction.getLocation());
        assertEquals(LocalDate.of(2025, 9, 25), auction.getCirculation().getEntryDeadline());
        assertEquals("(Valeur dates des enchères)", auction.getCirculation().getCommentEntryDeadline());
        assertEquals(LocalDate.of(2025, 10, 3), auction.getRegistration().getEntryDeadline());
        assertEquals("jusqu'au 26.06.2025", auction.getRegistration().getCommentEntryDeadline());

        assertEquals(1, auction.getObjects().size());
        String description = auction.getObjects().get(0).getDescription();
        assertTrue(description.contains("Parcelle No 4687"), description);
        assertTrue(description.contains("Estimation officielle : Fr. 342'000.00"), description);
        assertTrue(description.startsWith("<p"), description);
        assertNull(auction.getObjects().get(0).getLatitude());

        assertEquals(1, p.getDebtors().size());
        Debtor debtor = p.getDebtors().get(0);
        assertEquals(Debtor.DebtorType.PERSON, debtor.getType());
        PersonDebtor person = assertInstanceOf(PersonDebtor.class, debtor);
        assertEquals("Blein", person.getName());
        assertEquals("Blaise", person.getPrename());
        assertEquals(LocalDate.of(1964, 10, 15), person.getDateOfBirth());
        assertEquals(Debtor.ResidenceType.SWITZERLAND, person.getResidence());
        assertEquals(new SwissAddress("Rue du Port", "25", "1815", "Clarens"), person.getSwissAddress());
        assertEquals("Rue du Port 25", person.getDisplayAddress());
        assertEquals("1815", person.getPostalCode());
        assertEquals("Clarens", person.getCity());
    }

    @Test
    public void titleHasAllFourLanguages() throws Exception {
        Map<String, String> title = parser.parse(Fixtures.blein(), Fixtures.BLEIN_ID).getTitle();

        assertEquals(List.of("de", "fr", "it", "en"), List.copyOf(title.keySet()));
        assertEquals("Betreibungsamtliche Grundstücksteigerung Blaise Blein", title.get("de"));
        assertEquals("Vente aux enchères d'immeubles dans le cadre de la poursuite Blaise Blein", title.get("fr"));
        assertEquals("Incanto immobiliare Blaise Blein", title.get("it"));
        assertEquals("Property auction initiated by the debt enforcement office Blaise Blein", title.get("en"));
    }

    @Test
    public void missingTitleLanguagesAreEmptyStrings() throws Exception {
        ParsedPublication p = parser.parse(Fixtures.xml("company-foreign.xml"), Fixtures.COMPANY_ID);

        assertEquals(4, p.getTitle().size());
        assertEquals("Betreibungsamtliche Grundstücksteigerung", p.getTitle().get("de"));
        assertEquals("Vente aux enchères d'immeubles", p.getTitle().get("fr"));
        assertEquals("", p.getTitle().get("it"));
        assertEquals("", p.getTitle().get("en"));
    }

    @Test
    public void registrationOfficeBecomesOfficeContact() throws Exception {
        ParsedPublication p = parser.parse(Fixtures.blein(), Fixtures.BLEIN_ID);

        RegistrationOffice office = p.getRegistrationOffice();
        assertEquals(Fixtures.SION_OFFICE_ID, office.getId());
        assertEquals("Office des poursuites des districts de Sion, Hérens et Conthey", office.getDisplayName());
        assertEquals("Rue de la Piscine", office.getStreet());
        assertEquals("10", office.getStreetNumber());
        assertEquals("1950", office.getSwissZipCode());
        assertEquals("Sion", office.getTown());
        assertFalse(office.isContainsPostOfficeBox());

        assertEquals(1, p.getContacts().size());
        OfficeContact contact = assertInstanceOf(OfficeContact.class, p.getContacts().get(0));
        assertEquals(Fixtures.SION_OFFICE_ID, contact.getOfficeId());
        assertEquals("Rue de la Piscine 10", contact.getAddress());
        assertEquals("1950", contact.getPostalCode());
        assertEquals("Sion", contact.getCity());
        assertNull(contact.getPhone());
        assertEquals(Boolean.FALSE, contact.getContainsPostOfficeBox());
    }

    @Test
    public void parsesCompanyAndForeignDebtors() throws Exception {
        ParsedPublication p = parser.parse(Fixtures.xml("company-foreign.xml"), Fixtures.COMPANY_ID);

        // the third debtor has no name and is dropped
        assertEquals(2, p.getDebtors().size());

        CompanyDebtor company = assertInstanceOf(CompanyDebtor.class, p.getDebtors().get(0));
        assertEquals(Debtor.DebtorType.COMPANY, company.getType());
        assertEquals("Foncière Immobilière Nord Bernoise SA", company.getName());
        assertEquals("0106", company.getLegalForm());
        assertEquals("CHE-175.482.480", company.getUid());
        assertEquals("FR", company.getCanton());
        assertEquals(Debtor.ResidenceType.SWITZERLAND, company.getResidence());
        assertEquals("Boulevard de Pérolles 37", company.getDisplayAddress());
        assertEquals("1700", company.getPostalCode());
        assertEquals("Fribourg", company.getCity());

        PersonDebtor person = assertInstanceOf(PersonDebtor.class, p.getDebtors().get(1));
        assertEquals("JEBSEN", person.getName());
        assertEquals("Jan Henrik", person.getPrename());
        assertEquals("NO", person.getCountryOfOrigin().getIsoCode());
        assertEquals("Norway", person.getCountryOfOrigin().getName().get("en"));
        assertEquals("Norvège", person.getCountryOfOrigin().getName().get("fr"));
        assertEquals(Debtor.ResidenceType.FOREIGN, person.getResidence());
        assertNull(person.getSwissAddress());
        assertEquals("Storgata 5", person.getDisplayAddress());
        assertEquals("Oslo", person.getCity());
        assertEquals("0155", person.getPostalCode());
    }

    @Test
    public void debtorPayloadMatchesDiscriminator() throws Exception {
        ParsedPublication p = parser.parse(Fixtures.xml("company-foreign.xml"), Fixtures.COMPANY_ID);

        for (Debtor debtor : p.getDebtors()) {
            String kind = debtor.accept(new Debtor.Visitor<String>() {
                @Override
                public String visitPerson(PersonDebtor person) {
                    return "person";
                }

                @Override
                public String visitCompany(CompanyDebtor company) {
                    return "company";
                }
            });
            assertEquals(debtor.getType().getCode(), kind);
        }
    }

    @Test
    public void toleratesLenientFormatsAndMissingOptionalValues() throws Exception {
        ParsedPublication p = parser.parse(Fixtures.xml("company-foreign.xml"), Fixtures.COMPANY_ID);

        assertEquals(LocalDate.of(2025, 9, 5), p.getPublicationDate());
        assertNull(p.getExpirationDate());
        Auction auction = p.getAuctions().get(0);
        assertEquals(LocalDate.of(2025, 11, 12), auction.getDate());
        assertEquals(LocalTime.of(14, 30), auction.getTime());
        assertEquals(Auction.UNKNOWN_LOCATION, auction.getLocation());
        assertNull(auction.getCirculation().getEntryDeadline());
        assertNull(auction.getRegistration());
        assertEquals(ShabParser.derivedId(Fixtures.COMPANY_ID, "auction", 0), auction.getId());
        assertEquals("<p>Grundstück Nr. 1200, Tafers</p>", auction.getObjects().get(0).getDescription());
    }

    @Test
    public void readsPostOfficeBoxAndPersonContacts() throws Exception {
        ParsedPublication p = parser.parse(Fixtures.xml("company-foreign.xml"), Fixtures.COMPANY_ID);

        assertTrue(p.getRegistrationOffice().isContainsPostOfficeBox());
        assertEquals(new PostOfficeBox("88", "1712", "Tafers"), p.getRegistrationOffice().getPostOfficeBox());

        assertEquals(2, p.getContacts().size());
        assertEquals(Contact.ContactType.OFFICE, p.getContacts().get(0).getType());
        PersonContact person = assertInstanceOf(PersonContact.class, p.getContacts().get(1));
        assertEquals("Anna Meier", person.getName());
        assertEquals("+41 26 305 00 00", person.getPhone());
        assertEquals("anna.meier@example.ch", person.getEmail());
        assertNull(person.getOfficeId());
    }

    @Test
    public void structuredContactAddressIsJoinedFromItsParts() throws Exception {
        String xml = "<publication><meta><publicationDate>2025-09-05</publicationDate><cantons>BE</cantons>" +
                "<title><de>Grundstücksteigerung</de></title></meta><content>" +
                "<contact>\n  <contactType>person</contactType>\n  <prename>Anna</prename>\n  <name>Meier</name>\n" +
                "  <address>\n    <street>Poststrasse</street>\n    <houseNumber>25</houseNumber>\n" +
                "    <swissZipCode>3071</swissZipCode>\n    <town>Ostermundigen</town>\n  </address>\n</contact>" +
                "<contact><contactType>person</contactType><name>Keller</name>" +
                "<address>Bahnhofplatz 1</address><postalCode>3011</postalCode><city>Bern</city></contact>" +
                "</content></publication>";

        List<Contact> contacts = parser.parse(xml, "x").getContacts();

        assertEquals(2, contacts.size());
        assertEquals("Poststrasse 25", contacts.get(0).getAddress());
        assertEquals("3071", contacts.get(0).getPostalCode());
        assertEquals("Ostermundigen", contacts.get(0).getCity());
        assertEquals("Bahnhofplatz 1", contacts.get(1).getAddress());
        assertEquals("3011", contacts.get(1).getPostalCode());
        assertEquals("Bern", contacts.get(1).getCity());
    }

    @Test
    public void requestedIdWinsOverDocumentId() throws Exception {
        ParsedPublication p = parser.parse(Fixtures.blein(), "11111111-2222-3333-4444-555555555555");
        assertEquals("11111111-2222-3333-4444-555555555555", p.getId());
    }

    @Test
    public void missingPublicationDateFails() {
        String xml = Fixtures.blein().replace("<publicationDate>2025-09-05</publicationDate>", "");
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(xml, Fixtures.BLEIN_ID));
        assertTrue(e.getMessage().contains("publicationDate"), e.getMessage());
        assertEquals(Fixtures.BLEIN_ID, e.getPublicationId());
    }

    @Test
    public void missingCantonFails() {
        String xml = Fixtures.blein().replace("<cantons>VS</cantons>", "");
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(xml, Fixtures.BLEIN_ID));
        assertTrue(e.getMessage().contains("canton"), e.getMessage());
    }

    @Test
    public void titleWithoutAnyLanguageFails() {
        String xml = "<publication><meta><publicationDate>2025-09-05</publicationDate><cantons>VS</cantons>" +
                "<title><de> </de></title></meta></publication>";
        assertThrows(ParseException.class, () -> parser.parse(xml, "x"));
    }

    @Test
    public void unlocalisedTitleGoesToPublicationLanguage() throws Exception {
        String xml = "<publication><meta><language>it</language><publicationDate>2025-09-05</publicationDate>" +
                "<cantons>TI</cantons><title>Incanto immobiliare</title></meta></publication>";
        ParsedPublication p = parser.parse(xml, "x");
        assertEquals("Incanto immobiliare", p.getTitle().get("it"));
        assertEquals("", p.getTitle().get("de"));
        assertEquals("TI", p.getCanton());
    }

    @Test
    public void auctionWithoutDateFails() {
        String xml = Fixtures.blein().replace("<date>2025-10-23</date>", "");
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(xml, Fixtures.BLEIN_ID));
        assertTrue(e.getMessage().contains("date"), e.getMessage());
    }

    @Test
    public void foreignResidenceWithSwissAddressKeepsOnlyDisplayFields() throws Exception {
        String xml = Fixtures.blein().replace("<selectType>switzerland</selectType>", "<selectType>foreign</selectType>");
        PersonDebtor person = (PersonDebtor) parser.parse(xml, Fixtures.BLEIN_ID).getDebtors().get(0);

        assertEquals(Debtor.ResidenceType.FOREIGN, person.getResidence());
        assertNull(person.getSwissAddress());
        assertEquals("Rue du Port 25", person.getDisplayAddress());
        assertEquals("Clarens", person.getCity());
    }

    @Test
    public void contactLookupEnrichesOfficeContact() throws Exception {
        FakeShabClient client = new FakeShabClient().withOffice(Fixtures.SION_OFFICE_ID, "office-4095950d.json");
        ShabParser enriching = new ShabParser(new JsonContactLookup(client, new OfficeJsonReader(AppContext.createObjectMapper())));

        Contact contact = enriching.parse(Fixtures.blein(), Fixtures.BLEIN_ID).getContacts().get(0);

        assertEquals("+41 27 606 00 00", contact.getPhone());
        assertEquals("op-sion@admin.vs.ch", contact.getEmail());
        assertEquals(Boolean.TRUE, contact.getContainsPostOfficeBox());
        assertEquals("Rue de la Piscine 10", contact.getAddress());
        assertEquals(1, client.officeCalls(Fixtures.SION_OFFICE_ID));
    }
}
