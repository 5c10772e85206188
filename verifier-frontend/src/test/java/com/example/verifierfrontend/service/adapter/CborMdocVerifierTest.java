package com.example.verifierfrontend.service.adapter;

import com.authlete.cbor.CBORByteArray;
import com.authlete.cbor.CBORDecoder;
import com.authlete.cbor.CBORItemList;
import com.authlete.cbor.CBORPairList;
import com.authlete.cbor.CBORString;
import com.authlete.cose.COSEEC2Key;
import com.authlete.cose.COSEKey;
import com.authlete.mdoc.IssuerSignedBuilder;
import com.authlete.mdoc.ValidityInfo;
import com.example.verifierfrontend.exception.MdocVerificationException;
import com.example.verifierfrontend.model.MdocDocument;
import com.example.verifierfrontend.model.MdocVerifyResult;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Base64;
import java.util.Date;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CborMdocVerifierTest {

    // {"version": "1.0"}
    private static final String NO_DOCUMENTS = "a16776657273696f6e63312e30";
    // {"version": "1.0", "documents": [], "status": 10}
    private static final String ERROR_STATUS =
            "a36776657273696f6e63312e3069646f63756d656e747380667374617475730a";
    // {"version": "1.0", "documents": [{"docType": "org.iso.18013.5.1.mDL", "issuerSigned": {}}], "status": 0}
    private static final String DOCUMENT_WITHOUT_ISSUER_AUTH =
            "a36776657273696f6e63312e3069646f63756d656e747381a267646f6354797065756f72672e69736f2e31383031332e352e"
                    + "312e6d444c6c6973737565725369676e6564a06673746174757300";

    private static final String DOC_TYPE = "org.iso.18013.5.1.mDL";
    private static final String NAMESPACE = "org.iso.18013.5.1";

    private static final ZonedDateTime VALID_FROM = ZonedDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    private static final ZonedDateTime VALID_UNTIL = VALID_FROM.plusYears(1);

    private static final Clock WITHIN_VALIDITY = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
    private static final Clock AFTER_VALIDITY = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);

    private static byte[] issuerSigned;

    private final CborMdocVerifier verifier = new CborMdocVerifier(WITHIN_VALIDITY);

    @BeforeAll
    static void issueCredential() throws Exception {
        ECKey issuerKey = new ECKeyGenerator(Curve.P_256).algorithm(JWSAlgorithm.ES256).keyID("ds-1").generate();
        ECKey deviceKey = new ECKeyGenerator(Curve.P_256).algorithm(JWSAlgorithm.ES256).generate();

        issuerSigned = new IssuerSignedBuilder()
                .setDocType(DOC_TYPE)
                .setClaims(Map.of(NAMESPACE, Map.of("family_name", "Doe", "age_over_18", true)))
                .setValidityInfo(new ValidityInfo(VALID_FROM, VALID_FROM, VALID_UNTIL))
                .setDeviceKey(COSEKey.fromJwk(deviceKey.toPublicJWK().toJSONObject()))
                .setIssuerKey((COSEEC2Key) COSEKey.fromJwk(issuerKey.toJSONObject()))
                .setIssuerCertChain(List.of(documentSignerCertificate(issuerKey)))
                .build()
                .encode();
    }

    private static X509Certificate documentSignerCertificate(ECKey key) throws Exception {
        X500Name subject = new X500Name("CN=Test Document Signer, C=UT");
        JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(subject, BigInteger.ONE,
                Date.from(VALID_FROM.toInstant()), Date.from(VALID_UNTIL.toInstant()), subject, key.toECPublicKey());
        return new JcaX509CertificateConverter().getCertificate(
                builder.build(new JcaContentSignerBuilder("SHA256withECDSA").build(key.toECPrivateKey())));
    }

    private static String vpToken(String hex) {
        return encode(HexFormat.of().parseHex(hex));
    }

    private static String encode(byte[] cbor) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(cbor);
    }

    /**
     * {"version": "1.0", "documents": [{"docType": docType, "issuerSigned": ...}, ...], "status": 0}
     */
    private static byte[] deviceResponse(String docType, byte[]... issuerSignedDocuments) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0xa3);
        out.write(new CBORString("version").encode());
        out.write(new CBORString("1.0").encode());
        out.write(new CBORString("documents").encode());
        out.write(0x80 + issuerSignedDocuments.length);
        for (byte[] document : issuerSignedDocuments) {
            out.write(0xa2);
            out.write(new CBORString("docType").encode());
            out.write(new CBORString(docType).encode());
            out.write(new CBORString("issuerSigned").encode());
            out.write(document);
        }
        out.write(new CBORString("status").encode());
        out.write(0x00);
        return out.toByteArray();
    }

    private static byte[] withFlippedSignatureByte(byte[] issuerSignedBytes) throws Exception {
        CBORPairList decoded = (CBORPairList) new CBORDecoder(issuerSignedBytes).next();
        CBORItemList issuerAuth = (CBORItemList) decoded.findByKey("issuerAuth").getValue();
        byte[] signature = ((CBORByteArray) issuerAuth.getItems().get(3)).getValue();

        byte[] tampered = issuerSignedBytes.clone();
        int offset = indexOf(tampered, signature);
        assertThat(offset).isNotNegative();
        tampered[offset + signature.length / 2] ^= 0x01;
        return tampered;
    }

    private static int indexOf(byte[] data, byte[] target) {
        outer:
        for (int i = 0; i <= data.length - target.length; i++) {
            for (int j = 0; j < target.length; j++) {
                if (data[i + j] != target[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    @Test
    void validDocumentReturnsDisclosedClaims() throws Exception {
        MdocVerifyResult result = verifier.verify(encode(deviceResponse(DOC_TYPE, issuerSigned)));

        assertThat(result.valid()).isTrue();
        assertThat(result.documents()).hasSize(1);
        MdocDocument document = result.documents().get(0);
        assertThat(document.docType()).isEqualTo(DOC_TYPE);
        assertThat(document.claims().get(NAMESPACE))
                .containsEntry("family_name", "Doe")
                .containsEntry("age_over_18", true);
    }

    @Test
    void expiredCredentialIsInvalid() throws Exception {
        CborMdocVerifier later = new CborMdocVerifier(AFTER_VALIDITY);

        MdocVerifyResult result = later.verify(encode(deviceResponse(DOC_TYPE, issuerSigned)));

        assertThat(result.valid()).isFalse();
        assertThat(result.documents()).isEmpty();
    }

    @Test
    void docTypeNotMatchingMsoIsInvalid() throws Exception {
        MdocVerifyResult result = verifier.verify(encode(deviceResponse("org.iso.23220.photoid.1", issuerSigned)));

        assertThat(result.valid()).isFalse();
        assertThat(result.documents()).isEmpty();
    }

    @Test
    void tamperedIssuerSignatureIsInvalid() throws Exception {
        MdocVerifyResult result = verifier.verify(encode(deviceResponse(DOC_TYPE, withFlippedSignatureByte(issuerSigned))));

        assertThat(result.valid()).isFalse();
        assertThat(result.documents()).isEmpty();
    }

    @Test
    void oneFailingDocumentInvalidatesResponse() throws Exception {
        MdocVerifyResult result = verifier.verify(
                encode(deviceResponse(DOC_TYPE, issuerSigned, withFlippedSignatureByte(issuerSigned))));

        assertThat(result.valid()).isFalse();
        assertThat(result.documents()).extracting(MdocDocument::docType).containsExactly(DOC_TYPE);
    }

    @Test
    void deviceResponseWithoutDocumentsIsInvalid() {
        MdocVerifyResult result = verifier.verify(vpToken(NO_DOCUMENTS));

        assertThat(result.valid()).isFalse();
        assertThat(result.documents()).isEmpty();
    }

    @Test
    void nonZeroStatusIsInvalid() {
        assertThat(verifier.verify(vpToken(ERROR_STATUS)).valid()).isFalse();
    }

    @Test
    void documentFailingChecksIsDroppedNotThrown() {
        MdocVerifyResult result = verifier.verify(vpToken(DOCUMENT_WITHOUT_ISSUER_AUTH));

        assertThat(result.valid()).isFalse();
        assertThat(result.documents()).isEmpty();
    }

    @Test
    void paddedBase64IsAccepted() {
        String padded = Base64.getUrlEncoder().encodeToString(HexFormat.of().parseHex(NO_DOCUMENTS));

        assertThat(verifier.verify(padded).valid()).isFalse();
    }

    @Test
    void nonMapCborIsTechnicalError() {
        // "hello"
        assertThatThrownBy(() -> verifier.verify(vpToken("6568656c6c6f")))
                .isInstanceOf(MdocVerificationException.class)
                .hasMessageContaining("CBOR map");
    }

    @Test
    void invalidBase64IsTechnicalError() {
        assertThatThrownBy(() -> verifier.verify("***"))
                .isInstanceOf(MdocVerificationException.class);
    }

    @Test
    void emptyTokenIsTechnicalError() {
        assertThatThrownBy(() -> verifier.verify(" "))
                .isInstanceOf(MdocVerificationException.class)
                .hasMessage("VP token is empty");
    }

}
