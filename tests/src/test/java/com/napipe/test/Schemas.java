package com.napipe.test;

import com.napipe.schema.Field;
import com.napipe.schema.Schema;
import com.napipe.types.BooleanType;
import com.napipe.types.DoubleType;
import com.napipe.types.FloatType;
import com.napipe.types.IntegerType;
import com.napipe.types.StringType;
import com.napipe.types.TimeSpanType;
import com.napipe.types.VectorType;

/**
 * Schemas shared by planning and integration tests.
 */
public final class Schemas {

    private Schemas() {}

    /** One scalar double column {@code age}. */
    public static Schema age() {
        return new Schema(new Field("age", DoubleType.get()));
    }

    /**
     * A mix of every column shape:
     * {@code age:double, count:int, name:string, flag:boolean, wait:timespan,
     * feat:vector<float,3>, tokens:vector<float>}.
     */
    public static Schema mixed() {
        return new Schema(
            new Field("age", DoubleType.get()),
            new Field("count", IntegerType.get()),
            new Field("name", StringType.get()),
            new Field("flag", BooleanType.get()),
            new Field("wait", TimeSpanType.get()),
            new Field("feat", new VectorType(FloatType.get(), 3)),
            new Field("tokens", new VectorType(FloatType.get())));
    }
}
