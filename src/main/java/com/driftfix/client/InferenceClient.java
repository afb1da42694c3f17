package com.driftfix.client;

import com.driftfix.domain.FeatureMatrix;
import reactor.core.publisher.Mono;

public interface InferenceClient {

    Mono<FeatureMatrix> predict(String modelId, FeatureMatrix features);
}
