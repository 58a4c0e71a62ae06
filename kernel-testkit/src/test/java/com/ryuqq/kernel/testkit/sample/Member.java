package com.ryuqq.kernel.testkit.sample;

import com.ryuqq.kernel.core.domain.Aggregate;
import com.ryuqq.kernel.core.model.PropKey;
import com.ryuqq.kernel.core.model.Props;
import com.ryuqq.kernel.core.result.Result;
import com.ryuqq.kernel.core.spi.IdGenerator;

/**
 * 회원 Aggregate.
 */
public final class Member extends Aggregate<Member> {

    public static final PropKey<String> NICKNAME = PropKey.of("nickname", String.class);
    public static final PropKey<Email> EMAIL = PropKey.of("email", Email.class);
    public static final PropKey<Age> AGE = PropKey.of("age", Age.class);

    private Member(Props props, String id) {
        super(props, id);
    }

    private Member(Props props, IdGenerator idGenerator) {
        super(props, null, idGenerator);
    }

    public static Result<Member> create(Props props, String id) {
        Result<Void> valid = validate(props);
        if (valid.isFailure()) {
            return Result.fail(valid.error());
        }
        return Result.success(new Member(props, id));
    }

    public static Result<Member> create(Props props, IdGenerator idGenerator) {
        return validate(props).map(ignored -> new Member(props, idGenerator));
    }

    private static Result<Void> validate(Props props) {
        if (!validator().string(props.get(NICKNAME)).hasLengthBetween(2, 20)) {
            return Result.fail("Nickname must be between 2 and 20 characters");
        }
        if (validator().isNull(props.get(EMAIL))) {
            return Result.fail("Email is required");
        }
        return Result.ok();
    }
}
