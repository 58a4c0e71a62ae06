package com.ryuqq.kernel.testkit.sample;

import com.ryuqq.kernel.core.domain.ValueObject;
import com.ryuqq.kernel.core.model.PropKey;
import com.ryuqq.kernel.core.model.Props;
import com.ryuqq.kernel.core.result.Result;

/**
 * 나이 (0~130, 양 끝 포함).
 */
public final class Age extends ValueObject {

    public static final PropKey<Integer> VALUE = PropKey.of("value", Integer.class);

    private Age(Props props) {
        super(props);
    }

    public static boolean isValidValue(Integer value) {
        return validator().number(value).isBetween(0, 130);
    }

    public static Result<Age> create(Integer value) {
        if (!isValidValue(value)) {
            return Result.fail("Invalid value");
        }
        return Result.success(new Age(Props.of(VALUE, value)));
    }
}
