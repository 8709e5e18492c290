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
package io.ncsa.hmac.spi.signing;

import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Keyed-hash functions available for request signatures. The algorithm is never transmitted
 * with a request, so signer and verifier must be configured with the same value.
 */
public enum HashAlgorithm
{
    SHA256("HmacSHA256"),
    SHA384("HmacSHA384"),
    SHA512("HmacSHA512");

    public static final HashAlgorithm DEFAULT = SHA512;

    private final String macAlgorithm;

    HashAlgorithm(String macAlgorithm)
    {
        this.macAlgorithm = requireNonNull(macAlgorithm, "macAlgorithm is null");
    }

    public String macAlgorithm()
    {
        return macAlgorithm;
    }

    /**
     * Resolves names such as {@code sha512}, {@code SHA-512} or {@code HmacSHA512}.
     *
     * @throws UnsupportedHashAlgorithmException if the name does not denote a supported algorithm
     */
    public static HashAlgorithm fromName(String name)
    {
        requireNonNull(name, "name is null");
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace("-", "");
        if (normalized.startsWith("HMAC")) {
            normalized = normalized.substring("HMAC".length());
        }
        for (HashAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new UnsupportedHashAlgorithmException(name);
    }
}
