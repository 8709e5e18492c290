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
package io.ncsa.hmac.spi.credentials;

import java.util.Optional;

public interface SigningKeyProvider
{
    SigningKeyProvider NOOP = keyId -> Optional.empty();

    /**
     * Return the signing key registered under the given key id, if any. The key id is the
     * publicly visible part of an {@code Authorization} header and must be treated as
     * untrusted input.
     */
    Optional<SigningKey> signingKey(String keyId);
}
