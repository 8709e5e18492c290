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

public class UnsupportedHashAlgorithmException
        extends IllegalArgumentException
{
    private final String algorithmName;

    public UnsupportedHashAlgorithmException(String algorithmName)
    {
        super("Unsupported hash algorithm: " + algorithmName);
        this.algorithmName = algorithmName;
    }

    public UnsupportedHashAlgorithmException(String algorithmName, Throwable cause)
    {
        super("Unsupported hash algorithm: " + algorithmName, cause);
        this.algorithmName = algorithmName;
    }

    public String getAlgorithmName()
    {
        return algorithmName;
    }
}
