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
package io.ncsa.hmac.server.client;

import com.google.inject.Inject;
import io.airlift.http.client.Request;
import io.ncsa.hmac.spi.credentials.SigningKey;
import io.ncsa.hmac.spi.rest.RequestAdapter;
import io.ncsa.hmac.spi.signing.SignedRequest;
import io.ncsa.hmac.spi.signing.SigningController;

import static java.util.Objects.requireNonNull;

public class HmacRequestSigner
{
    private final SigningController signingController;
    private final RequestAdapter<Request> requestAdapter;

    @Inject
    public HmacRequestSigner(SigningController signingController)
    {
        this(signingController, new HttpClientRequestAdapter());
    }

    public HmacRequestSigner(SigningController signingController, RequestAdapter<Request> requestAdapter)
    {
        this.signingController = requireNonNull(signingController, "signingController is null");
        this.requestAdapter = requireNonNull(requestAdapter, "requestAdapter is null");
    }

    /**
     * Returns a copy of {@code request} carrying the {@code Authorization}, {@code Content-Digest}
     * and {@code Date} headers.
     */
    public Request sign(Request request, SigningKey signingKey)
    {
        SignedRequest signedRequest = signingController.signRequest(requestAdapter.requestDetails(request), signingKey);
        return requestAdapter.withSignature(request, signedRequest);
    }
}
