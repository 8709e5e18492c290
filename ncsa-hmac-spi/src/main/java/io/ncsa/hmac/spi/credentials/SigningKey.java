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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import static java.util.Objects.requireNonNull;

public record SigningKey(@JsonProperty("keyId") String keyId, @JsonProperty("keySecret") String keySecret)
{
    @JsonCreator
    public SigningKey
    {
        requireNonNull(keyId, "keyId is null");
        requireNonNull(keySecret, "keySecret is null");
    }

    @Override
    public String toString()
    {
        // never log the secret
        return "SigningKey{keyId=" + keyId + "}";
    }
}
