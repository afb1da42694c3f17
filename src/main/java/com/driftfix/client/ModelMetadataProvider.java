package com.driftfix.client;

import java.util.OptionalInt;

public interface ModelMetadataProvider {

    OptionalInt expectedFeatureCount(String modelId);
}
