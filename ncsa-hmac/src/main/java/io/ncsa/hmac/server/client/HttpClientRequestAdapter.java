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

import io.airlift.http.client.BodyGenerator;
import io.airlift.http.client.Request;
import io.airlift.http.client.StaticBodyGenerator;
import io.ncsa.hmac.server.rest.RequestDetailsBuilder;
import io.ncsa.hmac.spi.rest.RequestAdapter;
import io.ncsa.hmac.spi.signing.RequestDetails;
import io.ncsa.hmac.spi.signing.SignedRequest;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static io.airlift.http.client.Request.Builder.fromRequest;

/**
 * Signs outbound airlift HTTP client requests. Only requests with a {@link StaticBodyGenerator}
 * (or none) can be signed since the body must be known up front.
 */
public class HttpClientRequestAdapter
        implements RequestAdapter<Request>
{
    @Override
    public RequestDetails requestDetails(Request request)
    {
        String contentType = Optional.ofNullable(request.getHeader(CONTENT_TYPE_HEADER)).orElse("");

        return RequestDetails.builder(request.getMethod(), request.getUri().getRawPath())
                .withContentType(contentType)
                .withDate(request.getHeader(DATE_HEADER))
                .withParams(body(request)
                        .filter(bytes -> bytes.length > 0)
                        .map(bytes -> RequestDetailsBuilder.parseBody(contentType, bytes))
                        .orElse(null))
                .build();
    }

    @Override
    public Request withSignature(Request request, SignedRequest signedRequest)
    {
        return fromRequest(request)
                .setHeader(AUTHORIZATION_HEADER, signedRequest.authorization())
                .setHeader(CONTENT_DIGEST_HEADER, signedRequest.contentDigest())
                .setHeader(DATE_HEADER, signedRequest.date())
                .build();
    }

    private static Optional<byte[]> body(Request request)
    {
        BodyGenerator bodyGenerator = request.getBodyGenerator();
        if (bodyGenerator == null) {
            return Optional.empty();
        }
        checkArgument(bodyGenerator instanceof StaticBodyGenerator, "Cannot sign a request whose body is not static: %s", bodyGenerator.getClass().getSimpleName());
        return Optional.of(((StaticBodyGenerator) bodyGenerator).getBody());
    }
}
