package com.example.verifierfrontend.util;

import com.authlete.cbor.*;
import com.authlete.cose.COSESign1;
import com.nimbusds.jose.util.X509CertUtils;
import org.springframework.util.Assert;

import java.security.MessageDigest;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CBOR navigation helpers for ISO/IEC 18013-5 structures (DeviceResponse, IssuerSigned, MSO).
 * Decoded CBOR is handled as generic Authlete items; lookups that must succeed go through
 * {@link #required(CBORPairList, String)} and fail with {@link IllegalArgumentException}.
 */
public final class MdocCborHelper {

    /** COSE header label of the X.509 certificate chain (RFC 9360). */
    public static final int X5CHAIN_LABEL = 33;

    private static final int TAG_EPOCH_DATE = 0;
    private static final int TAG_DATE_TIME = 1;

    private MdocCborHelper() {
    }

    public static CBORItem decode(byte[] bytes) throws Exception {
        CBORDecoder decoder = new CBORDecoder(bytes);
        return (CBORItem) decoder.next();
    }

    public static CBORItem required(CBORPairList map, String key) {
        CBORPair pair = map.findByKey(key);
        Assert.notNull(pair, "'" + key + "' must be present");
        return (CBORItem) pair.getValue();
    }

    public static CBORPairList requiredMap(CBORPairList map, String key) {
        CBORItem value = required(map, key);
        Assert.isInstanceOf(CBORPairList.class, value, "'" + key + "' must be a map");
        return (CBORPairList) value;
    }

    public static CBORItemList requiredList(CBORPairList map, String key) {
        CBORItem value = required(map, key);
        Assert.isInstanceOf(CBORItemList.class, value, "'" + key + "' must be an array");
        return (CBORItemList) value;
    }

    public static String asString(Object item) {
        if (item instanceof CBORString cborString) {
            return cborString.getValue();
        }
        return String.valueOf(item);
    }

    public static long asLong(Object item) {
        if (item instanceof CBORInteger cborInteger) {
            return cborInteger.getValue();
        } else if (item instanceof CBORLong cborLong) {
            return cborLong.getValue();
        }
        throw new IllegalArgumentException("Expected an integer, got: " + typeName(item));
    }

    /**
     * Unwraps embedded CBOR ({@code #6.24(bstr .cbor X)} or a plain bstr) down to the inner item.
     */
    public static CBORItem unwrapEmbedded(CBORItem item) throws Exception {
        CBORItem current = item;
        if (current instanceof CBORTaggedItem tagged) {
            current = (CBORItem) tagged.getTagContent();
        }
        if (current instanceof CBORByteArray byteArray) {
            current = decode(byteArray.getValue());
        }
        if (current instanceof CBORTaggedItem tagged) {
            // MSO payloads are sometimes tagged twice
            current = unwrapEmbedded((CBORItem) tagged.getTagContent());
        }
        return current;
    }

    /**
     * Reads the Mobile Security Object carried as the IssuerAuth payload.
     */
    public static CBORPairList parseMso(COSESign1 issuerAuth) throws Exception {
        CBORItem payload = issuerAuth.getPayload();
        Assert.notNull(payload, "IssuerAuth must carry the MSO as payload");
        CBORItem mso = unwrapEmbedded(payload);
        Assert.isInstanceOf(CBORPairList.class, mso, "MSO must be a map");
        return (CBORPairList) mso;
    }

    /**
     * Returns the document signer certificate from the x5chain header, looking at the unprotected
     * header first as ISO 18013-5 places it there.
     */
    public static X509Certificate findSignerCertificate(COSESign1 issuerAuth) throws Exception {
        X509Certificate certificate = findCertificate(issuerAuth.getUnprotectedHeader());
        if (certificate == null) {
            certificate = findCertificate(issuerAuth.getProtectedHeader());
        }
        Assert.notNull(certificate, "IssuerAuth must carry an x5chain header");
        return certificate;
    }

    private static X509Certificate findCertificate(CBORItem header) throws Exception {
        if (header == null) {
            return null;
        }
        // protected headers are a bstr wrapping the map
        CBORItem decoded = decode(header.encode());
        if (decoded instanceof CBORByteArray byteArray) {
            byte[] inner = byteArray.getValue();
            if (inner == null || inner.length == 0) {
                return null;
            }
            decoded = decode(inner);
        }
        if (!(decoded instanceof CBORPairList headerMap)) {
            return null;
        }

        CBORPair x5chain = headerMap.findByKey(X5CHAIN_LABEL);
        if (x5chain == null) {
            return null;
        }
        Object value = x5chain.getValue();
        if (value instanceof CBORItemList chain) {
            Assert.isTrue(!chain.getItems().isEmpty(), "x5chain must not be empty");
            value = chain.getItems().get(0);
        }
        Assert.isInstanceOf(CBORByteArray.class, value, "x5chain entries must be byte strings");
        X509Certificate certificate = X509CertUtils.parse(((CBORByteArray) value).getValue());
        Assert.notNull(certificate, "x5chain does not contain a valid X.509 certificate");
        return certificate;
    }

    /**
     * Parses a tdate (tag 0 / tag 1, possibly nested) or epoch seconds into an instant.
     */
    public static Instant parseInstant(Object item) {
        Object current = item;
        while (current instanceof CBORTaggedItem tagged) {
            int tagNumber = tagged.getTagNumber().intValue();
            Object content = tagged.getTagContent();
            if (tagNumber == TAG_EPOCH_DATE && !(content instanceof CBORString)) {
                return epochInstant(content);
            }
            if (tagNumber == TAG_DATE_TIME && content instanceof CBORString) {
                return Instant.parse(((CBORString) content).getValue());
            }
            current = content;
        }

        if (current instanceof CBORString cborString) {
            return Instant.parse(cborString.getValue());
        }
        return epochInstant(current);
    }

    private static Instant epochInstant(Object item) {
        if (item instanceof CBORDouble cborDouble) {
            double seconds = cborDouble.getValue();
            return Instant.ofEpochSecond((long) seconds);
        }
        return Instant.ofEpochSecond(asLong(item));
    }

    /**
     * Checks one disclosed IssuerSignedItem against the MSO digest registered under its digestID.
     * The digest covers the tag-24 wrapped item as transmitted.
     */
    public static void verifyItemDigest(CBORItem taggedItem, CBORPairList namespaceDigests,
                                        MessageDigest digest, String namespace) throws Exception {
        CBORPairList item = decodeIssuerSignedItem(taggedItem);
        long digestIdValue = asLong(required(item, "digestID"));
        Assert.isTrue(digestIdValue >= 0 && digestIdValue <= Integer.MAX_VALUE,
                "digestID out of range in " + namespace + ": " + digestIdValue);
        int digestId = (int) digestIdValue;

        CBORPair expectedPair = namespaceDigests.findByKey(digestId);
        Assert.notNull(expectedPair, "No digest in MSO for " + namespace + "/" + digestId);
        Assert.isInstanceOf(CBORByteArray.class, expectedPair.getValue(), "MSO digest must be a byte string");
        byte[] expected = ((CBORByteArray) expectedPair.getValue()).getValue();

        digest.reset();
        byte[] actual = digest.digest(taggedItem.encode());
        Assert.isTrue(MessageDigest.isEqual(expected, actual),
                "Digest mismatch for " + namespace + "/" + digestId);
    }

    public static CBORPairList decodeIssuerSignedItem(CBORItem taggedItem) throws Exception {
        CBORItem item = unwrapEmbedded(taggedItem);
        Assert.isInstanceOf(CBORPairList.class, item, "IssuerSignedItem must be a map");
        return (CBORPairList) item;
    }

    /**
     * Converts a CBOR element value to plain Java: maps, lists, strings, numbers, booleans;
     * byte strings become base64 and full-dates their string form.
     */
    public static Object toJava(Object value) {
        if (value instanceof CBORPairList pairList) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (CBORPair pair : pairList.getPairs()) {
                map.put(asString(pair.getKey()), toJava(pair.getValue()));
            }
            return map;
        } else if (value instanceof CBORItemList itemList) {
            return itemList.getItems().stream().map(MdocCborHelper::toJava).toList();
        } else if (value instanceof CBORString cborString) {
            return cborString.getValue();
        } else if (value instanceof CBORInteger cborInteger) {
            return cborInteger.getValue();
        } else if (value instanceof CBORLong cborLong) {
            return cborLong.getValue();
        } else if (value instanceof CBORDouble cborDouble) {
            return cborDouble.getValue();
        } else if (value instanceof CBORBoolean cborBoolean) {
            return cborBoolean.getValue();
        } else if (value instanceof CBORByteArray byteArray) {
            return Base64.getEncoder().encodeToString(byteArray.getValue());
        } else if (value instanceof CBORTaggedItem tagged) {
            return toJava(tagged.getTagContent());
        } else if (value instanceof CBORNull) {
            return null;
        }
        return value != null ? value.toString() : null;
    }

    static String typeName(Object item) {
        return item == null ? "null" : item.getClass().getSimpleName();
    }

}
