package com.example.shab;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;

/**
 * SQLite store for ingested publications. Each {@link #upsert(ParsedPublication)} is one
 * IMMEDIATE transaction: the existence check and all inserts hold the write lock together,
 * so two workers racing on the same identifier end with exactly one stored graph.
 */
@Slf4j
public class DatabaseManager {
    private static final Set<String> TABLES = Set.of("publications", "auctions", "auction_objects", "debtors", "contacts");

    private final String dbPath;
    private final String dbUrl;
    private final Properties connectionProperties;
    private final ObjectMapper mapper;

    public DatabaseManager(String dbPath, int busyTimeoutMillis, ObjectMapper mapper) {
        this.dbPath = dbPath;
        this.dbUrl = "jdbc:sqlite:" + dbPath;
        this.mapper = mapper;
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(busyTimeoutMillis);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = config.toProperties();
        createDbDirectoryIfNotExists();
        initializeDatabase();
    }

    private void createDbDirectoryIfNotExists() {
        File dbDir = new File(dbPath).getAbsoluteFile().getParentFile();
        if (dbDir == null || dbDir.exists()) {
            return;
        }
        if (dbDir.mkdirs()) {
            log.info("Created database directory: {}", dbDir);
        } else {
            throw new ConfigurationException("Cannot create database directory " + dbDir);
        }
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(dbUrl, connectionProperties);
    }

    private void initializeDatabase() {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS publications (" +
                    "id TEXT PRIMARY KEY, " +
                    "rubric TEXT, " +
                    "sub_rubric TEXT, " +
                    "publication_date TEXT NOT NULL, " +
                    "expiration_date TEXT, " +
                    "title TEXT NOT NULL, " +
                    "language TEXT NOT NULL, " +
                    "canton TEXT NOT NULL, " +
                    "registration_office TEXT, " +
                    "created_at TEXT NOT NULL)");
            // source auction ids are only unique within their publication
            stmt.execute("CREATE TABLE IF NOT EXISTS auctions (" +
                    "id TEXT PRIMARY KEY, " +
                    "source_id TEXT NOT NULL, " +
                    "publication_id TEXT NOT NULL REFERENCES publications(id) ON DELETE CASCADE, " +
                    "position INTEGER NOT NULL, " +
                    "date TEXT NOT NULL, " +
                    "time TEXT, " +
                    "location TEXT NOT NULL, " +
                    "circulation_entry_deadline TEXT, " +
                    "circulation_comment_deadline TEXT, " +
                    "registration_entry_deadline TEXT, " +
                    "registration_comment_deadline TEXT, " +
                    "created_at TEXT NOT NULL, " +
                    "UNIQUE (publication_id, source_id))");
            stmt.execute("CREATE TABLE IF NOT EXISTS auction_objects (" +
                    "id TEXT PRIMARY KEY, " +
                    "auction_id TEXT NOT NULL REFERENCES auctions(id) ON DELETE CASCADE, " +
                    "position INTEGER NOT NULL, " +
                    "description TEXT, " +
                    "latitude REAL, " +
                    "longitude REAL, " +
                    "created_at TEXT NOT NULL)");
            stmt.execute("CREATE TABLE IF NOT EXISTS debtors (" +
                    "id TEXT PRIMARY KEY, " +
                    "publication_id TEXT NOT NULL REFERENCES publications(id) ON DELETE CASCADE, " +
                    "position INTEGER NOT NULL, " +
                    "debtor_type TEXT NOT NULL CHECK (debtor_type IN ('person', 'company')), " +
                    "name TEXT NOT NULL, " +
                    "prename TEXT, " +
                    "date_of_birth TEXT, " +
                    "country_of_origin TEXT, " +
                    "legal_form TEXT, " +
                    "uid TEXT, " +
                    "company_canton TEXT, " +
                    "residence_type TEXT CHECK (residence_type IN ('switzerland', 'foreign')), " +
                    "street TEXT, " +
                    "house_number TEXT, " +
                    "swiss_zip_code TEXT, " +
                    "town TEXT, " +
                    "address TEXT, " +
                    "city TEXT, " +
                    "postal_code TEXT, " +
                    "created_at TEXT NOT NULL, " +
                    "CHECK (debtor_type = 'person' OR (prename IS NULL AND date_of_birth IS NULL AND country_of_origin IS NULL)), " +
                    "CHECK (debtor_type = 'company' OR (legal_form IS NULL AND uid IS NULL AND company_canton IS NULL)), " +
                    "CHECK (residence_type = 'switzerland' OR (street IS NULL AND house_number IS NULL AND swiss_zip_code IS NULL AND town IS NULL)))");
            stmt.execute("CREATE TABLE IF NOT EXISTS contacts (" +
                    "id TEXT PRIMARY KEY, " +
                    "publication_id TEXT NOT NULL REFERENCES publications(id) ON DELETE CASCADE, " +
                    "position INTEGER NOT NULL, " +
                    "contact_type TEXT NOT NULL CHECK (contact_type IN ('office', 'person')), " +
                    "name TEXT NOT NULL, " +
                    "address TEXT, " +
                    "postal_code TEXT, " +
                    "city TEXT, " +
                    "phone TEXT, " +
                    "email TEXT, " +
                    "office_id TEXT, " +
                    "contains_post_office_box INTEGER, " +
                    "post_office_box TEXT, " +
                    "created_at TEXT NOT NULL, " +
                    "CHECK (contact_type = 'office' OR office_id IS NULL))");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_publications_canton ON publications (canton)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_publications_date ON publications (publication_date)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_auctions_publication ON auctions (publication_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_auctions_date ON auctions (date)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_auction_objects_auction ON auction_objects (auction_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_debtors_publication ON debtors (publication_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_contacts_publication ON contacts (publication_id)");
            log.info("Database tables initialized at {}", dbUrl);
        } catch (SQLException e) {
            throw new ConfigurationException("Cannot initialize database at " + dbUrl + ": " + e.getMessage(), e);
        }
    }

    public boolean exists(String publicationId) throws StorageException {
        try (Connection conn = connect()) {
            return exists(conn, publicationId);
        } catch (SQLException e) {
            throw new StorageException(publicationId, "Error checking publication " + publicationId + ": " + e.getMessage(), e);
        }
    }

    private boolean exists(Connection conn, String publicationId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM publications WHERE id = ?")) {
            stmt.setString(1, publicationId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Inserts the whole graph, or nothing when the publication is already stored.
     *
     * @throws StorageException after a full rollback, when any write fails
     */
    public UpsertOutcome upsert(ParsedPublication publication) throws StorageException {
        String id = publication.getId();
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                if (exists(conn, id)) {
                    conn.rollback();
                    log.info("Publication {} already stored, skipping", id);
                    return UpsertOutcome.SKIPPED_DUPLICATE;
                }
                String now = Instant.now().toString();
                insertPublication(conn, publication, now);
                insertAuctions(conn, publication, now);
                insertDebtors(conn, publication, now);
                insertContacts(conn, publication, now);
                conn.commit();
                log.info("Stored publication {} ({} auctions, {} debtors, {} contacts)", id,
                        publication.getAuctions().size(), publication.getDebtors().size(), publication.getContacts().size());
                return UpsertOutcome.INSERTED;
            } catch (SQLException | JsonProcessingException | RuntimeException e) {
                rollback(conn, id);
                if (e instanceof SQLException && exists(conn, id)) {
                    // lost a race against a concurrent insert of the same identifier
                    log.info("Publication {} was stored concurrently, skipping", id);
                    return UpsertOutcome.SKIPPED_DUPLICATE;
                }
                throw new StorageException(id, "Error storing publication " + id + ": " + e.getMessage(), e);
            }
        } catch (SQLException e) {
            throw new StorageException(id, "Error storing publication " + id + ": " + e.getMessage(), e);
        }
    }

    private void rollback(Connection conn, String id) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed for publication {}: {}", id, e.getMessage(), e);
        }
    }

    private void insertPublication(Connection conn, ParsedPublication p, String now) throws SQLException, JsonProcessingException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO publications (id, rubric, sub_rubric, publication_date, expiration_date, title, language, canton, registration_office, created_at) " +
                        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            stmt.setString(1, p.getId());
            stmt.setString(2, p.getRubric());
            stmt.setString(3, p.getSubRubric());
            stmt.setString(4, p.getPublicationDate().toString());
            setNullable(stmt, 5, p.getExpirationDate());
            stmt.setString(6, mapper.writeValueAsString(p.getTitle()));
            stmt.setString(7, p.getLanguage());
            stmt.setString(8, p.getCanton());
            stmt.setString(9, p.getRegistrationOffice() == null ? null : mapper.writeValueAsString(p.getRegistrationOffice()));
            stmt.setString(10, now);
            stmt.executeUpdate();
        }
    }

    private void insertAuctions(Connection conn, ParsedPublication p, String now) throws SQLException {
        try (PreparedStatement auctionStmt = conn.prepareStatement(
                "INSERT INTO auctions (id, source_id, publication_id, position, date, time, location, circulation_entry_deadline, " +
                        "circulation_comment_deadline, registration_entry_deadline, registration_comment_deadline, created_at) " +
                        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)");
             PreparedStatement objectStmt = conn.prepareStatement(
                     "INSERT INTO auction_objects (id, auction_id, position, description, latitude, longitude, created_at) " +
                             "VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            int position = 0;
            for (Auction a : p.getAuctions()) {
                String rowId = UUID.randomUUID().toString();
                auctionStmt.setString(1, rowId);
                auctionStmt.setString(2, a.getId());
                auctionStmt.setString(3, p.getId());
                auctionStmt.setInt(4, position++);
                auctionStmt.setString(5, a.getDate().toString());
                setNullable(auctionStmt, 6, a.getTime());
                auctionStmt.setString(7, a.getLocation());
                Deadline circulation = a.getCirculation();
                setNullable(auctionStmt, 8, circulation == null ? null : circulation.getEntryDeadline());
                auctionStmt.setString(9, circulation == null ? null : circulation.getCommentEntryDeadline());
                Deadline registration = a.getRegistration();
                setNullable(auctionStmt, 10, registration == null ? null : registration.getEntryDeadline());
                auctionStmt.setString(11, registration == null ? null : registration.getCommentEntryDeadline());
                auctionStmt.setString(12, now);
                auctionStmt.executeUpdate();

                int objectPosition = 0;
                for (AuctionObject o : a.getObjects()) {
                    objectStmt.setString(1, UUID.randomUUID().toString());
                    objectStmt.setString(2, rowId);
                    objectStmt.setInt(3, objectPosition++);
                    objectStmt.setString(4, o.getDescription());
                    objectStmt.setObject(5, o.getLatitude(), Types.REAL);
                    objectStmt.setObject(6, o.getLongitude(), Types.REAL);
                    objectStmt.setString(7, now);
                    objectStmt.executeUpdate();
                }
            }
        }
    }

    private void insertDebtors(Connection conn, ParsedPublication p, String now) throws SQLException, JsonProcessingException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO debtors (id, publication_id, position, debtor_type, name, prename, date_of_birth, country_of_origin, " +
                        "legal_form, uid, company_canton, residence_type, street, house_number, swiss_zip_code, town, " +
                        "address, city, postal_code, created_at) " +
                        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            int position = 0;
            for (Debtor d : p.getDebtors()) {
                stmt.setString(1, UUID.randomUUID().toString());
                stmt.setString(2, p.getId());
                stmt.setInt(3, position++);
                stmt.setString(4, d.getType().getCode());
                stmt.setString(5, d.getName());
                VariantColumns variant = d.accept(VARIANT_COLUMNS);
                stmt.setString(6, variant.prename);
                setNullable(stmt, 7, variant.dateOfBirth);
                stmt.setString(8, variant.countryOfOrigin == null ? null : mapper.writeValueAsString(variant.countryOfOrigin));
                stmt.setString(9, variant.legalForm);
                stmt.setString(10, variant.uid);
                stmt.setString(11, variant.canton);
                stmt.setString(12, d.getResidence() == null ? null : d.getResidence().getCode());
                SwissAddress swiss = d.getResidence() == Debtor.ResidenceType.SWITZERLAND ? d.getSwissAddress() : null;
                stmt.setString(13, swiss == null ? null : swiss.getStreet());
                stmt.setString(14, swiss == null ? null : swiss.getHouseNumber());
                stmt.setString(15, swiss == null ? null : swiss.getSwissZipCode());
                stmt.setString(16, swiss == null ? null : swiss.getTown());
                stmt.setString(17, d.getDisplayAddress());
                stmt.setString(18, d.getCity());
                stmt.setString(19, d.getPostalCode());
                stmt.setString(20, now);
                stmt.executeUpdate();
            }
        }
    }

    private void insertContacts(Connection conn, ParsedPublication p, String now) throws SQLException, JsonProcessingException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO contacts (id, publication_id, position, contact_type, name, address, postal_code, city, phone, email, " +
                        "office_id, contains_post_office_box, post_office_box, created_at) " +
                        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            int position = 0;
            for (Contact c : p.getContacts()) {
                stmt.setString(1, UUID.randomUUID().toString());
                stmt.setString(2, p.getId());
                stmt.setInt(3, position++);
                stmt.setString(4, c.getType().getCode());
                stmt.setString(5, c.getName());
                stmt.setString(6, c.getAddress());
                stmt.setString(7, c.getPostalCode());
                stmt.setString(8, c.getCity());
                stmt.setString(9, c.getPhone());
                stmt.setString(10, c.getEmail());
                stmt.setString(11, c.getOfficeId());
                if (c.getContainsPostOfficeBox() == null) {
                    stmt.setNull(12, Types.INTEGER);
                } else {
                    stmt.setInt(12, c.getContainsPostOfficeBox() ? 1 : 0);
                }
                stmt.setString(13, c.getPostOfficeBox() == null ? null : mapper.writeValueAsString(c.getPostOfficeBox()));
                stmt.setString(14, now);
                stmt.executeUpdate();
            }
        }
    }

    /** Columns owned by one debtor variant; the other variant's columns stay null. */
    private static final class VariantColumns {
        private String prename;
        private LocalDate dateOfBirth;
        private Country countryOfOrigin;
        private String legalForm;
        private String uid;
        private String canton;
    }

    private static final Debtor.Visitor<VariantColumns> VARIANT_COLUMNS = new Debtor.Visitor<VariantColumns>() {
        @Override
        public VariantColumns visitPerson(PersonDebtor person) {
            VariantColumns columns = new VariantColumns();
            columns.prename = person.getPrename();
            columns.dateOfBirth = person.getDateOfBirth();
            columns.countryOfOrigin = person.getCountryOfOrigin();
            return columns;
        }

        @Override
        public VariantColumns visitCompany(CompanyDebtor company) {
            VariantColumns columns = new VariantColumns();
            columns.legalForm = company.getLegalForm();
            columns.uid = company.getUid();
            columns.canton = company.getCanton();
            return columns;
        }
    };

    private static void setNullable(PreparedStatement stmt, int index, Object value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value.toString());
        }
    }

    public int countRows(String table) throws StorageException {
        if (!TABLES.contains(table)) {
            throw new IllegalArgumentException("Unknown table " + table);
        }
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StorageException(null, "Error counting " + table + ": " + e.getMessage(), e);
        }
    }

    public List<String> findPublicationIds() throws StorageException {
        List<String> ids = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement("SELECT id FROM publications ORDER BY publication_date, id");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("id"));
            }
        } catch (SQLException e) {
            throw new StorageException(null, "Error listing publications: " + e.getMessage(), e);
        }
        return ids;
    }

    /** Source auction ids of a publication in source order. */
    public List<String> findAuctionIds(String publicationId) throws StorageException {
        List<String> ids = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(
                     "SELECT source_id FROM auctions WHERE publication_id = ? ORDER BY position")) {
            stmt.setString(1, publicationId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("source_id"));
                }
            }
        } catch (SQLException e) {
            throw new StorageException(publicationId, "Error reading auctions of " + publicationId + ": " + e.getMessage(), e);
        }
        return ids;
    }

    /** Debtor type codes of a publication in source order. */
    public List<String> findDebtorTypes(String publicationId) throws StorageException {
        List<String> types = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(
                     "SELECT debtor_type FROM debtors WHERE publication_id = ? ORDER BY position")) {
            stmt.setString(1, publicationId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    types.add(rs.getString("debtor_type"));
                }
            }
        } catch (SQLException e) {
            throw new StorageException(publicationId, "Error reading debtors of " + publicationId + ": " + e.getMessage(), e);
        }
        return types;
    }
}
