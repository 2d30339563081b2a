package com.certparser.masterlist.persistence;

import com.certparser.masterlist.model.CertificateRecord;
import com.certparser.masterlist.model.CrlRecord;
import com.certparser.masterlist.model.MasterListPayload;
import com.certparser.masterlist.model.RevokedCertificateRecord;
import com.certparser.masterlist.port.CertificateRepository;
import com.certparser.railway.ComposableExecutionContext;
import com.certparser.railway.ErrorCode;
import com.certparser.railway.ExecutionContext;
import com.certparser.railway.LoggingExecutionContext;
import com.certparser.railway.Result;
import com.certparser.railway.TransactionalExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
public class CertificateJdbcRepository implements CertificateRepository {
    private static final Logger log = LoggerFactory.getLogger(CertificateJdbcRepository.class);
    static final String STORE_FAILURE_MESSAGE = "Failed to persist certificates to database";

    private static final String ROOT_CA_TABLE = "root_ca";
    private static final String DSC_TABLE = "dsc";

    private final NamedParameterJdbcTemplate jdbc;
    private final ExecutionContext storeContext;

    public CertificateJdbcRepository(NamedParameterJdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = jdbc;
        this.storeContext = ComposableExecutionContext.of(
            new LoggingExecutionContext("CertificateStore"),
            new TransactionalExecutionContext(transactionManager)
        );
    }

    @Override
    public Result<Integer> store(MasterListPayload payload) {
        return storeContext.execute(
            () -> Result.fromComputation(() -> replaceAll(payload), ErrorCode.DATABASE_ERROR, STORE_FAILURE_MESSAGE)
        );
    }

    private Integer replaceAll(MasterListPayload payload) {
        // children first so the crl foreign key never dangles
        jdbc.getJdbcTemplate().update("DELETE FROM revoked_certificate_list");
        jdbc.getJdbcTemplate().update("DELETE FROM crls");
        jdbc.getJdbcTemplate().update("DELETE FROM " + DSC_TABLE);
        jdbc.getJdbcTemplate().update("DELETE FROM " + ROOT_CA_TABLE);

        Timestamp updatedAt = Timestamp.from(Instant.now());
        insertCertificates(ROOT_CA_TABLE, payload.rootCas(), updatedAt);
        insertCertificates(DSC_TABLE, payload.dscs(), updatedAt);
        insertCrls(payload.crls(), updatedAt);
        insertRevoked(payload.revokedCertificates(), updatedAt);

        log.info(
            "Replaced certificate store rootCas={} dscs={} crls={} revoked={}",
            payload.rootCas().size(),
            payload.dscs().size(),
            payload.crls().size(),
            payload.revokedCertificates().size()
        );
        return payload.totalItems();
    }

    private void insertCertificates(String table, List<CertificateRecord> records, Timestamp updatedAt) {
        if (records.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO %s (
              id, certificate, subject_key_identifier, authority_key_identifier,
              issuer, x_500_issuer, source, isn, updated_at
            ) VALUES (
              :id, :certificate, :ski, :aki, :issuer, :x500Issuer, :source, :isn, :updatedAt
            )
            """.formatted(table);
        SqlParameterSource[] batch = records.stream()
            .map(record -> new MapSqlParameterSource()
                .addValue("id", record.id())
                .addValue("certificate", record.certificate())
                .addValue("ski", record.subjectKeyIdentifier())
                .addValue("aki", record.authorityKeyIdentifier())
                .addValue("issuer", record.issuer())
                .addValue("x500Issuer", record.x500Issuer())
                .addValue("source", record.source())
                .addValue("isn", record.isn())
                .addValue("updatedAt", updatedAt))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(sql, batch);
    }

    private void insertCrls(List<CrlRecord> records, Timestamp updatedAt) {
        if (records.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO crls (id, crl, source, issuer, country, updated_at)
            VALUES (:id, :crl, :source, :issuer, :country, :updatedAt)
            """;
        SqlParameterSource[] batch = records.stream()
            .map(record -> new MapSqlParameterSource()
                .addValue("id", record.id())
                .addValue("crl", record.crl())
                .addValue("source", record.source())
                .addValue("issuer", record.issuer())
                .addValue("country", record.country())
                .addValue("updatedAt", updatedAt))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(sql, batch);
    }

    private void insertRevoked(List<RevokedCertificateRecord> records, Timestamp updatedAt) {
        if (records.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO revoked_certificate_list (
              id, source, country, isn, crl, revocation_reason, revocation_date, updated_at
            ) VALUES (
              :id, :source, :country, :isn, :crl, :reason, :revocationDate, :updatedAt
            )
            """;
        SqlParameterSource[] batch = records.stream()
            .map(record -> new MapSqlParameterSource()
                .addValue("id", record.id())
                .addValue("source", record.source())
                .addValue("country", record.country())
                .addValue("isn", record.isn())
                .addValue("crl", record.crlId())
                .addValue("reason", record.revocationReason())
                .addValue("revocationDate", record.revocationDate() == null ? null : Timestamp.from(record.revocationDate()))
                .addValue("updatedAt", updatedAt))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(sql, batch);
    }

    public List<CertificateRecord> findRootCas() {
        return findCertificates(ROOT_CA_TABLE);
    }

    public List<CertificateRecord> findDscs() {
        return findCertificates(DSC_TABLE);
    }

    private List<CertificateRecord> findCertificates(String table) {
        String sql = """
            SELECT id, certificate, subject_key_identifier, authority_key_identifier,
                   issuer, x_500_issuer, source, isn, updated_at
            FROM %s
            ORDER BY isn
            """.formatted(table);
        return jdbc.query(sql, new MapSqlParameterSource(), CERTIFICATE_MAPPER);
    }

    public List<CrlRecord> findCrls() {
        String sql = """
            SELECT id, crl, source, issuer, country, updated_at
            FROM crls
            ORDER BY issuer
            """;
        return jdbc.query(sql, new MapSqlParameterSource(), (rs, rowNum) -> new CrlRecord(
            rs.getBytes("crl"),
            rs.getObject("id", UUID.class),
            rs.getString("source"),
            rs.getString("issuer"),
            rs.getString("country"),
            toInstant(rs.getTimestamp("updated_at"))
        ));
    }

    public List<RevokedCertificateRecord> findRevokedCertificates() {
        String sql = """
            SELECT id, source, country, isn, crl, revocation_reason, revocation_date, updated_at
            FROM revoked_certificate_list
            ORDER BY isn
            """;
        return jdbc.query(sql, new MapSqlParameterSource(), (rs, rowNum) -> new RevokedCertificateRecord(
            rs.getObject("id", UUID.class),
            rs.getString("source"),
            rs.getString("country"),
            rs.getString("isn"),
            rs.getObject("crl", UUID.class),
            rs.getString("revocation_reason"),
            toInstant(rs.getTimestamp("revocation_date")),
            toInstant(rs.getTimestamp("updated_at"))
        ));
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put(ROOT_CA_TABLE, countTable(ROOT_CA_TABLE));
        counts.put(DSC_TABLE, countTable(DSC_TABLE));
        counts.put("crls", countTable("crls"));
        counts.put("revoked_certificate_list", countTable("revoked_certificate_list"));
        return counts;
    }

    private long countTable(String table) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0L : count;
    }

    private static final RowMapper<CertificateRecord> CERTIFICATE_MAPPER = CertificateJdbcRepository::mapCertificate;

    private static CertificateRecord mapCertificate(ResultSet rs, int rowNum) throws SQLException {
        return new CertificateRecord(
            rs.getBytes("certificate"),
            rs.getObject("id", UUID.class),
            rs.getString("subject_key_identifier"),
            rs.getString("authority_key_identifier"),
            rs.getString("issuer"),
            rs.getBytes("x_500_issuer"),
            rs.getString("source"),
            rs.getString("isn"),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
