package com.certparser.masterlist.parser;

import com.certparser.masterlist.model.CertificateRecord;
import com.certparser.masterlist.model.CrlRecord;
import com.certparser.masterlist.model.MasterListPayload;
import com.certparser.masterlist.model.RevokedCertificateRecord;
import com.certparser.masterlist.port.MasterListParser;
import com.certparser.railway.ErrorCode;
import com.certparser.railway.Result;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.ASN1Set;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.DERSet;
import org.bouncycastle.asn1.cms.SignedData;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.asn1.x509.AuthorityKeyIdentifier;
import org.bouncycastle.asn1.x509.CRLReason;
import org.bouncycastle.asn1.x509.Certificate;
import org.bouncycastle.asn1.x509.CertificateList;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.SubjectKeyIdentifier;
import org.bouncycastle.asn1.x509.TBSCertList;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.CMSTypedData;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.security.auth.x500.X500Principal;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Extracts root CA certificates, CRLs and revoked entries from a CMS signed ICAO Master List.
 * The signature itself is not verified.
 */
@Component
public class CmsMasterListParser implements MasterListParser {
    private static final Logger log = LoggerFactory.getLogger(CmsMasterListParser.class);

    public static final String SOURCE = "icao-masterlist";
    static final String PARSE_FAILURE_MESSAGE = "Failed to parse CMS Master List binary";

    @Override
    public Result<MasterListPayload> parse(byte[] rawBinary) {
        return Result.fromComputation(() -> extractBounded(rawBinary), ErrorCode.TECHNICAL_ERROR, PARSE_FAILURE_MESSAGE)
            .flatMap(extraction -> MasterListPayload.create(
                extraction.rootCas(),
                List.of(),
                extraction.crls(),
                extraction.revoked()
            ))
            .peek(payload -> log.info(
                "Parsed master list rootCas={} crls={} revoked={} totalItems={}",
                payload.rootCas().size(),
                payload.crls().size(),
                payload.revokedCertificates().size(),
                payload.totalItems()
            ));
    }

    // ASN.1 decoding recurses once per nesting level, so hostile input can exhaust the stack
    private Extraction extractBounded(byte[] rawBinary) throws CMSException, IOException {
        try {
            return extract(rawBinary);
        } catch (StackOverflowError e) {
            throw new IOException("ASN.1 nesting too deep", e);
        }
    }

    private Extraction extract(byte[] rawBinary) throws CMSException, IOException {
        if (rawBinary == null || rawBinary.length == 0) {
            throw new CMSException("master list binary is empty");
        }
        CMSSignedData cms = new CMSSignedData(rawBinary);
        SignedData signedData = SignedData.getInstance(cms.toASN1Structure().getContent());

        List<CertificateRecord> rootCas = new ArrayList<>();
        int innerCount = 0;
        for (ASN1Encodable element : innerCertificates(cms)) {
            rootCas.add(toCertificateRecord(Certificate.getInstance(element)));
            innerCount++;
        }
        int outerCount = 0;
        ASN1Set outer = signedData.getCertificates();
        if (outer != null) {
            for (ASN1Encodable element : outer) {
                // only plain certificates; attribute and other certificate choices are tagged
                if (element.toASN1Primitive() instanceof ASN1Sequence) {
                    rootCas.add(toCertificateRecord(Certificate.getInstance(element)));
                    outerCount++;
                }
            }
        }

        List<CrlRecord> crls = new ArrayList<>();
        List<RevokedCertificateRecord> revoked = new ArrayList<>();
        ASN1Set crlSet = signedData.getCRLs();
        if (crlSet != null) {
            for (ASN1Encodable element : crlSet) {
                if (element.toASN1Primitive() instanceof ASN1Sequence) {
                    extractCrl(CertificateList.getInstance(element), crls, revoked);
                }
            }
        }
        log.debug("Master list envelope innerCertificates={} outerCertificates={}", innerCount, outerCount);
        return new Extraction(rootCas, crls, revoked);
    }

    private ASN1Set innerCertificates(CMSSignedData cms) throws IOException {
        CMSTypedData content = cms.getSignedContent();
        if (content == null || !(content.getContent() instanceof byte[] octets) || octets.length == 0) {
            return new DERSet();
        }
        ASN1Sequence masterList = ASN1Sequence.getInstance(ASN1Primitive.fromByteArray(octets));
        if (masterList.size() < 2) {
            throw new IOException("CscaMasterList must contain a version and a certificate set");
        }
        ASN1Integer version = ASN1Integer.getInstance(masterList.getObjectAt(0));
        log.debug("CscaMasterList version {}", version.getValue());
        return ASN1Set.getInstance(masterList.getObjectAt(1));
    }

    private CertificateRecord toCertificateRecord(Certificate certificate) throws IOException {
        X509CertificateHolder holder = new X509CertificateHolder(certificate);
        X500Name issuer = holder.getIssuer();
        String ski = subjectKeyIdentifier(holder);
        String aki = authorityKeyIdentifier(holder);
        return new CertificateRecord(
            certificate.getEncoded(),
            UUID.randomUUID(),
            ski,
            aki,
            displayName(issuer),
            issuer.getEncoded(),
            SOURCE,
            toHexSerial(holder.getSerialNumber()),
            null
        );
    }

    private void extractCrl(CertificateList crl, List<CrlRecord> crls, List<RevokedCertificateRecord> revoked)
        throws IOException {
        X500Name issuer = crl.getIssuer();
        String country = countryOf(issuer);
        UUID crlId = UUID.randomUUID();
        crls.add(new CrlRecord(crl.getEncoded(), crlId, SOURCE, displayName(issuer), country, null));

        for (TBSCertList.CRLEntry entry : crl.getRevokedCertificates()) {
            revoked.add(new RevokedCertificateRecord(
                UUID.randomUUID(),
                SOURCE,
                country,
                toHexSerial(entry.getUserCertificate().getValue()),
                crlId,
                revocationReason(entry.getExtensions()),
                entry.getRevocationDate().getDate().toInstant(),
                null
            ));
        }
    }

    private String subjectKeyIdentifier(X509CertificateHolder holder) {
        Extension extension = holder.getExtension(Extension.subjectKeyIdentifier);
        if (extension == null) {
            log.warn("Certificate {} has no subject key identifier", toHexSerial(holder.getSerialNumber()));
            return null;
        }
        try {
            return Hex.toHexString(SubjectKeyIdentifier.getInstance(extension.getParsedValue()).getKeyIdentifier());
        } catch (IllegalArgumentException e) {
            log.warn("Certificate {} has an unreadable subject key identifier", toHexSerial(holder.getSerialNumber()), e);
            return null;
        }
    }

    private String authorityKeyIdentifier(X509CertificateHolder holder) {
        Extension extension = holder.getExtension(Extension.authorityKeyIdentifier);
        if (extension == null) {
            log.debug("Certificate {} has no authority key identifier", toHexSerial(holder.getSerialNumber()));
            return null;
        }
        try {
            byte[] keyIdentifier = AuthorityKeyIdentifier.getInstance(extension.getParsedValue()).getKeyIdentifier();
            if (keyIdentifier == null) {
                log.debug("Authority key identifier of {} carries no key id", toHexSerial(holder.getSerialNumber()));
                return null;
            }
            return Hex.toHexString(keyIdentifier);
        } catch (IllegalArgumentException e) {
            log.warn("Certificate {} has an unreadable authority key identifier", toHexSerial(holder.getSerialNumber()), e);
            return null;
        }
    }

    private String revocationReason(Extensions extensions) {
        if (extensions == null) {
            return null;
        }
        Extension extension = extensions.getExtension(Extension.reasonCode);
        if (extension == null) {
            return null;
        }
        int code;
        try {
            code = CRLReason.getInstance(extension.getParsedValue()).getValue().intValue();
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed CRL reason code extension", e);
            return null;
        }
        return reasonName(code);
    }

    private String reasonName(int code) {
        return RevocationReason.fromCode(code)
            .map(RevocationReason::rfcName)
            .orElseGet(() -> {
                log.warn("Ignoring unknown CRL reason code {}", code);
                return null;
            });
    }

    static String countryOf(X500Name name) {
        RDN[] rdns = name.getRDNs(BCStyle.C);
        if (rdns.length == 0 || rdns[0].getFirst() == null) {
            return null;
        }
        ASN1Encodable value = rdns[0].getFirst().getValue();
        String country = value instanceof ASN1String text ? text.getString() : IETFUtils.valueToString(value);
        return country == null || country.isBlank() ? null : country.trim();
    }

    static String displayName(X500Name name) throws IOException {
        return new X500Principal(name.getEncoded()).getName(X500Principal.RFC2253);
    }

    static String toHexSerial(BigInteger serial) {
        if (serial.signum() < 0) {
            return "-0x" + serial.negate().toString(16);
        }
        return "0x" + serial.toString(16);
    }

    private record Extraction(
        List<CertificateRecord> rootCas,
        List<CrlRecord> crls,
        List<RevokedCertificateRecord> revoked
    ) {
    }
}
