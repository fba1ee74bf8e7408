package org.energysaving.datapipeline.api.timeseries;

/**
 * Tag names the core reads and writes on every point.
 */
public final class TagNames {

    public static final String DATACENTER = "datacenter";
    public static final String DEVICE_TYPE = "device_type";
    public static final String DEVICE = "device";

    /** Reference to the test result a prediction or expectation belongs to. */
    public static final String TEST_RESULT = "test_result";

    /** Reference to the prediction run of an applied model. */
    public static final String PREDICTION = "prediction";

    /** Either {@code prediction} or {@code expectation}. */
    public static final String MEASUREMENT_KIND = "measurement_kind";

    private TagNames() {
    }
}
