/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.ncsa.hmac.server.signing;

import io.ncsa.hmac.server.signing.Canonicalizer.CanonicalRequest;
import io.ncsa.hmac.spi.signing.HashAlgorithm;
import io.ncsa.hmac.spi.signing.RequestAuthorization;
import io.ncsa.hmac.spi.signing.RequestDetails;
import io.ncsa.hmac.spi.signing.SignedRequest;
import io.ncsa.hmac.spi.signing.SigningException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

public final class Signer
{
    private final Canonicalizer canonicalizer;

    public Signer(Canonicalizer canonicalizer)
    {
        this.canonicalizer = requireNonNull(canonicalizer, "canonicalizer is null");
    }

    /**
     * Base64 (standard alphabet, padded) HMAC of the canonical request under {@code keySecret}.
     */
    public String signature(RequestDetails requestDetails, String keySecret, HashAlgorithm hashAlgorithm)
    {
        requireKeyPart(keySecret, "key_secret");
        return signature(canonicalizer.canonicalize(requestDetails), keySecret, hashAlgorithm);
    }

    public String signature(RequestDetails requestDetails, String keySecret)
    {
        return signature(requestDetails, keySecret, HashAlgorithm.DEFAULT);
    }

    /**
     * Returns the credential {@code "<serviceName> <keyId>:<signature>"}.
     *
     * @throws SigningException if {@code keyId} or {@code keySecret} is null or empty, checked in that order
     */
    public String sign(RequestDetails requestDetails, String keyId, String keySecret, HashAlgorithm hashAlgorithm, String serviceName)
    {
        return signRequest(requestDetails, keyId, keySecret, hashAlgorithm, serviceName).authorization();
    }

    public String sign(RequestDetails requestDetails, String keyId, String keySecret)
    {
        return sign(requestDetails, keyId, keySecret, HashAlgorithm.DEFAULT, RequestAuthorization.DEFAULT_SERVICE_NAME);
    }

    public SignedRequest signRequest(RequestDetails requestDetails, String keyId, String keySecret, HashAlgorithm hashAlgorithm, String serviceName)
    {
        requireKeyPart(keyId, "key_id");
        requireKeyPart(keySecret, "key_secret");
        requireNonNull(hashAlgorithm, "hashAlgorithm is null");
        requireNonNull(serviceName, "serviceName is null");

        CanonicalRequest canonicalRequest = canonicalizer.canonicalize(requestDetails);
        String signature = signature(canonicalRequest, keySecret, hashAlgorithm);
        return new SignedRequest(new RequestAuthorization(serviceName, keyId, signature), canonicalRequest.contentDigest(), canonicalRequest.date());
    }

    static String signature(CanonicalRequest canonicalRequest, String keySecret, HashAlgorithm hashAlgorithm)
    {
        Mac mac;
        try {
            mac = Mac.getInstance(hashAlgorithm.macAlgorithm());
            mac.init(new SecretKeySpec(keySecret.getBytes(UTF_8), hashAlgorithm.macAlgorithm()));
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
        catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        }
        byte[] digest = mac.doFinal(canonicalRequest.canonicalString().getBytes(UTF_8));
        return Base64.getEncoder().encodeToString(digest);
    }

    private static void requireKeyPart(String value, String fieldName)
    {
        if ((value == null) || value.isEmpty()) {
            throw new SigningException(fieldName);
        }
    }
}
