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

import static java.util.Objects.requireNonNull;

/**
 * Raised when a request cannot be signed because the caller supplied incomplete key material.
 * Retrying without fixing the caller's configuration will fail the same way.
 */
public class SigningException
        extends RuntimeException
{
    private final String fieldName;

    public SigningException(String fieldName)
    {
        super(requireNonNull(fieldName, "fieldName is null") + " is required");
        this.fieldName = fieldName;
    }

    public String getFieldName()
    {
        return fieldName;
    }
}
