package com.farewatch.ml.store;

public record ModelArtifacts(byte[] detectorBlob, byte[] scalerBlob) {}
