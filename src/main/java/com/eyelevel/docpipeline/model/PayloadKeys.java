package com.eyelevel.docpipeline.model;

/**
 * Well-known keys of the {@link StagePayload}. They are also the field names of the published result document.
 */
public final class PayloadKeys {

    public static final String BUCKET = "bucket";
    public static final String KEY = "key";
    public static final String METADATA = "metadata";
    public static final String TEXT = "text";
    public static final String ANALYSIS = "analysis";
    public static final String RESULT_PATH = "resultPath";

    private PayloadKeys() {
    }
}
