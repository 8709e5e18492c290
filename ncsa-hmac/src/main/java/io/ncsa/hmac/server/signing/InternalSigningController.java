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

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.ncsa.hmac.spi.credentials.SigningKey;
import io.ncsa.hmac.spi.credentials.SigningKeyProvider;
import io.ncsa.hmac.spi.signing.HashAlgorithm;
import io.ncsa.hmac.spi.signing.RequestAuthorization;
import io.ncsa.hmac.spi.signing.RequestDetails;
import io.ncsa.hmac.spi.signing.SignedRequest;
import io.ncsa.hmac.spi.signing.SigningController;
import io.ncsa.hmac.spi.signing.VerificationResult;
import io.ncsa.hmac.spi.timestamps.RequestTimestamp;

import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import static io.ncsa.hmac.spi.signing.VerificationResult.AUTHENTICATED;
import static io.ncsa.hmac.spi.signing.VerificationResult.SIGNATURE_MISMATCH;
import static io.ncsa.hmac.spi.signing.VerificationResult.UNKNOWN_KEY_ID;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

public class InternalSigningController
        implements SigningController
{
    private static final Logger log = Logger.get(SigningController.class);

    // signs requests for unknown key ids so both outcomes take the same time
    private static final String UNKNOWN_KEY_SECRET = "unknown-key-secret";

    private final SigningKeyProvider signingKeyProvider;
    private final HashAlgorithm hashAlgorithm;
    private final String serviceName;
    private final Optional<Duration> maxClockDrift;
    private final Clock clock;
    private final Signer signer;

    @Inject
    public InternalSigningController(SigningKeyProvider signingKeyProvider, SigningConfig signingConfig, Clock clock)
    {
        this.signingKeyProvider = requireNonNull(signingKeyProvider, "signingKeyProvider is null");
        this.clock = requireNonNull(clock, "clock is null");

        hashAlgorithm = signingConfig.getHashAlgorithm();
        serviceName = signingConfig.getServiceName();
        maxClockDrift = Optional.ofNullable(signingConfig.getMaxClockDrift()).map(io.airlift.units.Duration::toJavaTime);
        signer = new Signer(new Canonicalizer(signingConfig.getBodylessMethods(), clock));
    }

    @Override
    public SignedRequest signRequest(RequestDetails requestDetails, SigningKey signingKey)
    {
        return signer.signRequest(requestDetails, signingKey.keyId(), signingKey.keySecret(), hashAlgorithm, serviceName);
    }

    @Override
    public VerificationResult validateAuthorization(RequestDetails requestDetails, RequestAuthorization requestAuthorization)
    {
        if (!requestAuthorization.isValid()) {
            log.debug("Invalid requestAuthorization. Request: %s", requestDetails);
            return SIGNATURE_MISMATCH;
        }
        if (!serviceName.equals(requestAuthorization.serviceName())) {
            log.debug("Unexpected service name. Expected: %s Actual: %s", serviceName, requestAuthorization.serviceName());
            return SIGNATURE_MISMATCH;
        }

        // a defaulted date can never match the one the client signed
        Optional<String> requestDate = requestDetails.date().filter(date -> !date.isEmpty());
        if (requestDate.isEmpty()) {
            log.debug("Missing request date. Request: %s", requestDetails);
            return SIGNATURE_MISMATCH;
        }
        if (maxClockDrift.isPresent() && !isWithinClockDrift(requestDate.get(), maxClockDrift.get())) {
            return SIGNATURE_MISMATCH;
        }

        Optional<SigningKey> signingKey = signingKeyProvider.signingKey(requestAuthorization.keyId());
        String keySecret = signingKey.map(SigningKey::keySecret).orElse(UNKNOWN_KEY_SECRET);

        String expectedSignature = signer.signature(requestDetails, keySecret, hashAlgorithm);
        boolean signatureMatches = MessageDigest.isEqual(expectedSignature.getBytes(UTF_8), requestAuthorization.signature().getBytes(UTF_8));
        if (signingKey.isEmpty()) {
            log.debug("Unknown key id: %s", requestAuthorization.keyId());
            return UNKNOWN_KEY_ID;
        }
        if (signatureMatches) {
            return AUTHENTICATED;
        }

        log.debug("Signature mismatch. Key id: %s Request: %s", requestAuthorization.keyId(), requestDetails);
        return SIGNATURE_MISMATCH;
    }

    private boolean isWithinClockDrift(String requestDate, Duration maxClockDrift)
    {
        Instant requestInstant;
        try {
            requestInstant = RequestTimestamp.fromRequestTimestamp(requestDate);
        }
        catch (DateTimeParseException e) {
            log.debug("Request date is not an ISO-8601 timestamp: %s", requestDate);
            return false;
        }

        Instant now = clock.instant();
        Duration driftFromNow = Duration.between(now, requestInstant);
        if ((driftFromNow.compareTo(maxClockDrift.negated()) < 0) || (driftFromNow.compareTo(maxClockDrift) > 0)) {
            log.debug("Request time exceeds max drift. RequestTime: %s Now: %s", requestInstant, now);
            return false;
        }
        return true;
    }
}
