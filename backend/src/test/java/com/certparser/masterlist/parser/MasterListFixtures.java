package com.certparser.masterlist.parser;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DEROctetString;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.DERSet;
import org.bouncycastle.asn1.cms.CMSObjectIdentifiers;
import org.bouncycastle.asn1.cms.ContentInfo;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.cert.X509CRLHolder;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v2CRLBuilder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedDataGenerator;
import org.bouncycastle.cms.jcajce.JcaSignerInfoGeneratorBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.bouncycastle.util.CollectionStore;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;

/**
 * Builds signed Master List envelopes with BouncyCastle for parser and pipeline tests.
 */
public final class MasterListFixtures {
    public static final ASN1ObjectIdentifier CSCA_MASTER_LIST = new ASN1ObjectIdentifier("2.23.136.1.1.2");
    public static final Instant REVOCATION_DATE = Instant.parse("2024-03-01T12:00:00Z");

    private static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

    private MasterListFixtures() {
    }

    public record Revocation(BigInteger serial, int reasonCode) {
    }

    public static KeyPair keyPair() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(256);
        return generator.generateKeyPair();
    }

    public static X509CertificateHolder certificate(String dn, long serial, boolean withKeyIdentifiers) throws Exception {
        return certificate(dn, serial, keyPair(), withKeyIdentifiers);
    }

    public static X509CertificateHolder certificate(String dn, long serial, KeyPair keys, boolean withKeyIdentifiers)
        throws Exception {
        X500Name name = new X500Name(dn);
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
            name,
            BigInteger.valueOf(serial),
            Date.from(now.minus(1, ChronoUnit.DAYS)),
            Date.from(now.plus(3650, ChronoUnit.DAYS)),
            name,
            keys.getPublic()
        );
        if (withKeyIdentifiers) {
            JcaX509ExtensionUtils utils = new JcaX509ExtensionUtils();
            builder.addExtension(Extension.subjectKeyIdentifier, false, utils.createSubjectKeyIdentifier(keys.getPublic()));
            builder.addExtension(Extension.authorityKeyIdentifier, false, utils.createAuthorityKeyIdentifier(keys.getPublic()));
        }
        return builder.build(signer(keys));
    }

    /**
     * CRL signed by {@code keys}; a reason code of 0 leaves the entry without a reason extension.
     */
    public static X509CRLHolder crl(String issuerDn, KeyPair keys, List<Revocation> revocations) throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        X509v2CRLBuilder builder = new X509v2CRLBuilder(new X500Name(issuerDn), Date.from(now));
        builder.setNextUpdate(Date.from(now.plus(30, ChronoUnit.DAYS)));
        for (Revocation revocation : revocations) {
            builder.addCRLEntry(revocation.serial(), Date.from(REVOCATION_DATE), revocation.reasonCode());
        }
        return builder.build(signer(keys));
    }

    /**
     * CRL whose single entry carries a reason code extension encoded as INTEGER instead of ENUMERATED.
     */
    public static X509CRLHolder crlWithMalformedReason(String issuerDn, KeyPair keys, BigInteger serial) throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        X509v2CRLBuilder builder = new X509v2CRLBuilder(new X500Name(issuerDn), Date.from(now));
        Extension badReason = new Extension(Extension.reasonCode, false, new DEROctetString(new ASN1Integer(1)));
        builder.addCRLEntry(serial, Date.from(REVOCATION_DATE), new Extensions(badReason));
        return builder.build(signer(keys));
    }

    public static byte[] masterList(
        List<X509CertificateHolder> inner,
        List<X509CertificateHolder> outer,
        List<X509CRLHolder> crls
    ) throws Exception {
        return signedEnvelope(masterListContent(inner), outer, crls, true);
    }

    public static byte[] masterListContent(List<X509CertificateHolder> inner) throws Exception {
        ASN1EncodableVector certificates = new ASN1EncodableVector();
        for (X509CertificateHolder certificate : inner) {
            certificates.add(certificate.toASN1Structure());
        }
        DERSequence masterList = new DERSequence(new ASN1Encodable[] {new ASN1Integer(0), new DERSet(certificates)});
        return masterList.getEncoded(ASN1Encoding.DER);
    }

    public static byte[] signedEnvelope(
        byte[] content,
        List<X509CertificateHolder> outer,
        List<X509CRLHolder> crls,
        boolean encapsulate
    ) throws Exception {
        KeyPair signerKeys = keyPair();
        X509CertificateHolder signerCertificate = certificate("C=SC,O=Test Authority,CN=Master List Signer", 9999L, signerKeys, true);

        CMSSignedDataGenerator generator = new CMSSignedDataGenerator();
        generator.addSignerInfoGenerator(
            new JcaSignerInfoGeneratorBuilder(new JcaDigestCalculatorProviderBuilder().build())
                .build(signer(signerKeys), signerCertificate)
        );
        if (!outer.isEmpty()) {
            generator.addCertificates(new CollectionStore<>(outer));
        }
        for (X509CRLHolder crl : crls) {
            generator.addCRL(crl);
        }
        return generator.generate(new CMSProcessableByteArray(CSCA_MASTER_LIST, content), encapsulate).getEncoded();
    }

    /**
     * A well-formed CMS ContentInfo that is plain data rather than signed data.
     */
    public static byte[] dataContentInfo() throws Exception {
        return new ContentInfo(CMSObjectIdentifiers.data, new DEROctetString(new byte[] {1, 2, 3})).getEncoded();
    }

    private static ContentSigner signer(KeyPair keys) throws Exception {
        return new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(keys.getPrivate());
    }
}
