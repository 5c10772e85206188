package com.example.verifierfrontend.service.adapter;

import com.authlete.cbor.CBORItem;
import com.authlete.cbor.CBORItemList;
import com.authlete.cbor.CBORPair;
import com.authlete.cbor.CBORPairList;
import com.authlete.cose.COSESign1;
import com.authlete.cose.COSEVerifier;
import com.example.verifierfrontend.exception.MdocVerificationException;
import com.example.verifierfrontend.model.MdocDocument;
import com.example.verifierfrontend.model.MdocVerifyResult;
import com.example.verifierfrontend.service.port.MdocVerifier;
import com.example.verifierfrontend.util.MdocCborHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verifies an ISO/IEC 18013-5 DeviceResponse using Authlete's CBOR/COSE support.
 *
 * For every document: IssuerAuth signature with the document signer key from x5chain,
 * MSO validity window, SHA-256 value digests of the disclosed items. Disclosed claims are
 * returned per namespace. Issuer trust (IACA chain) and DeviceAuth are not checked here.
 */
@Component
public class CborMdocVerifier implements MdocVerifier {

    private static final Logger logger = LoggerFactory.getLogger(CborMdocVerifier.class);

    private static final String SUPPORTED_DIGEST_ALGORITHM = "SHA-256";

    private final Clock clock;

    public CborMdocVerifier() {
        this(Clock.systemUTC());
    }

    CborMdocVerifier(Clock clock) {
        this.clock = clock;
    }

    @Override
    public MdocVerifyResult verify(String vpToken) {
        CBORPairList deviceResponse = decodeDeviceResponse(vpToken);

        CBORPair statusPair = deviceResponse.findByKey("status");
        if (statusPair != null) {
            long status = MdocCborHelper.asLong(statusPair.getValue());
            if (status != 0) {
                logger.warn("DeviceResponse reports status {}", status);
                return MdocVerifyResult.invalid();
            }
        }

        CBORPair documentsPair = deviceResponse.findByKey("documents");
        if (documentsPair == null || !(documentsPair.getValue() instanceof CBORItemList documents)
                || documents.getItems().isEmpty()) {
            logger.warn("DeviceResponse contains no documents");
            return MdocVerifyResult.invalid();
        }

        boolean valid = true;
        List<MdocDocument> verified = new ArrayList<>();
        int index = 0;
        for (CBORItem item : documents.getItems()) {
            try {
                Assert.isInstanceOf(CBORPairList.class, item, "Document must be a map");
                verified.add(verifyDocument((CBORPairList) item));
            } catch (Exception e) {
                logger.warn("mDoc document {} failed verification: {}", index, e.getMessage());
                valid = false;
            }
            index++;
        }

        logger.debug("mDoc verification finished: valid={}, documents={}", valid, verified.size());
        return new MdocVerifyResult(valid, verified);
    }

    private static CBORPairList decodeDeviceResponse(String vpToken) {
        if (!StringUtils.hasText(vpToken)) {
            throw new MdocVerificationException("VP token is empty");
        }
        try {
            CBORItem decoded = MdocCborHelper.decode(Base64.getUrlDecoder().decode(vpToken.trim()));
            if (!(decoded instanceof CBORPairList deviceResponse)) {
                throw new MdocVerificationException("DeviceResponse must be a CBOR map");
            }
            return deviceResponse;
        } catch (MdocVerificationException e) {
            throw e;
        } catch (Exception e) {
            throw new MdocVerificationException("VP token is not a base64url encoded CBOR DeviceResponse", e);
        }
    }

    private MdocDocument verifyDocument(CBORPairList document) throws Exception {
        String docType = MdocCborHelper.asString(MdocCborHelper.required(document, "docType"));
        CBORPairList issuerSigned = MdocCborHelper.requiredMap(document, "issuerSigned");

        COSESign1 issuerAuth = COSESign1.build(MdocCborHelper.requiredList(issuerSigned, "issuerAuth"));
        CBORPairList mso = MdocCborHelper.parseMso(issuerAuth);

        verifyIssuerAuth(issuerAuth);
        verifyDocType(mso, docType);
        verifyValidityInfo(mso);

        CBORPairList nameSpaces = MdocCborHelper.requiredMap(issuerSigned, "nameSpaces");
        verifyDigests(mso, nameSpaces);

        return new MdocDocument(docType, extractClaims(nameSpaces));
    }

    private static void verifyIssuerAuth(COSESign1 issuerAuth) throws Exception {
        X509Certificate signer = MdocCborHelper.findSignerCertificate(issuerAuth);
        PublicKey publicKey = signer.getPublicKey();

        boolean verified = new COSEVerifier(publicKey).verify(issuerAuth);
        Assert.isTrue(verified, "IssuerAuth signature verification failed");
        logger.debug("IssuerAuth verified with document signer {}", signer.getSubjectX500Principal());
    }

    private static void verifyDocType(CBORPairList mso, String docType) {
        String msoDocType = MdocCborHelper.asString(MdocCborHelper.required(mso, "docType"));
        Assert.isTrue(docType.equals(msoDocType),
                "docType mismatch: document=" + docType + ", MSO=" + msoDocType);
    }

    private void verifyValidityInfo(CBORPairList mso) {
        CBORPairList validityInfo = MdocCborHelper.requiredMap(mso, "validityInfo");
        Instant validFrom = MdocCborHelper.parseInstant(MdocCborHelper.required(validityInfo, "validFrom"));
        Instant validUntil = MdocCborHelper.parseInstant(MdocCborHelper.required(validityInfo, "validUntil"));
        Instant now = clock.instant();

        Assert.isTrue(!now.isBefore(validFrom), "Credential is not yet valid (validFrom " + validFrom + ")");
        Assert.isTrue(!now.isAfter(validUntil), "Credential has expired (validUntil " + validUntil + ")");
    }

    private static void verifyDigests(CBORPairList mso, CBORPairList nameSpaces) throws Exception {
        String algorithm = MdocCborHelper.asString(MdocCborHelper.required(mso, "digestAlgorithm"));
        Assert.isTrue(SUPPORTED_DIGEST_ALGORITHM.equals(algorithm), "Unsupported digest algorithm: " + algorithm);

        CBORPairList valueDigests = MdocCborHelper.requiredMap(mso, "valueDigests");
        MessageDigest sha256 = MessageDigest.getInstance(SUPPORTED_DIGEST_ALGORITHM);

        for (CBORPair namespaceEntry : nameSpaces.getPairs()) {
            String namespace = MdocCborHelper.asString(namespaceEntry.getKey());
            CBORPairList namespaceDigests = MdocCborHelper.requiredMap(valueDigests, namespace);
            Assert.isInstanceOf(CBORItemList.class, namespaceEntry.getValue(), "Namespace " + namespace + " must be an array");
            for (CBORItem item : ((CBORItemList) namespaceEntry.getValue()).getItems()) {
                MdocCborHelper.verifyItemDigest(item, namespaceDigests, sha256, namespace);
            }
        }
    }

    private static Map<String, Map<String, Object>> extractClaims(CBORPairList nameSpaces) throws Exception {
        Map<String, Map<String, Object>> claims = new LinkedHashMap<>();
        for (CBORPair namespaceEntry : nameSpaces.getPairs()) {
            Map<String, Object> namespaceClaims = new LinkedHashMap<>();
            for (CBORItem item : ((CBORItemList) namespaceEntry.getValue()).getItems()) {
                CBORPairList issuerSignedItem = MdocCborHelper.decodeIssuerSignedItem(item);
                String name = MdocCborHelper.asString(MdocCborHelper.required(issuerSignedItem, "elementIdentifier"));
                namespaceClaims.put(name, MdocCborHelper.toJava(MdocCborHelper.required(issuerSignedItem, "elementValue")));
            }
            claims.put(MdocCborHelper.asString(namespaceEntry.getKey()), namespaceClaims);
        }
        return claims;
    }

}
