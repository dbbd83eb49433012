package com.ferrybooking.common.security;

import com.ferrybooking.common.exception.ForbiddenActionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActorTest {

    @Test
    void missingRole_defaultsToUser() {
        Actor actor = Actor.of(7L, null);

        assertThat(actor.role()).isEqualTo(ActorRole.USER);
        assertThat(actor.isOperator()).isFalse();
        assertThat(actor.owns(7L)).isTrue();
        assertThat(actor.owns(8L)).isFalse();
    }

    @Test
    void adminCountsAsOperator() {
        Actor admin = Actor.of(1L, ActorRole.ADMIN);

        assertThat(admin.isOperator()).isTrue();
        assertThatCode(admin::requireOperator).doesNotThrowAnyException();
        assertThatCode(admin::requireAdmin).doesNotThrowAnyException();
    }

    @Test
    void operatorIsNotAdmin() {
        Actor operator = Actor.of(2L, ActorRole.OPERATOR);

        assertThatCode(operator::requireOperator).doesNotThrowAnyException();
        assertThatThrownBy(operator::requireAdmin).isInstanceOf(ForbiddenActionException.class);
    }
}
