package ai.diagram.composer.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.diagram.composer.error.EmptyNameException;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IdentitiesTest {

    @Test
    void sanitizeReplacesSpacesAndDropsMarkupCharacters() {
        assertThat(Identities.sanitize("Fraud Check")).isEqualTo("Fraud_Check");
        assertThat(Identities.sanitize("Say \"hi\"")).isEqualTo("Say_hi");
        assertThat(Identities.sanitize("a.b(c)")).isEqualTo("abc");
        assertThat(Identities.sanitize("!!!")).isEqualTo("_");
    }

    @Test
    void aliasWinsOverSanitizedName() {
        assertThat(Identities.derive("Fraud Check", "fc")).isEqualTo("fc");
        assertThat(Identities.derive("Fraud Check", " ")).isEqualTo("Fraud_Check");
        assertThat(Identities.derive("Fraud Check", null)).isEqualTo("Fraud_Check");
    }

    @Test
    void aliasesWithWhitespaceOrMarkupAreRefused() {
        assertThat(Identities.requireAlias("fraud_check-2")).isEqualTo("fraud_check-2");
        assertThat(catchThrowable(() -> Identities.derive("Fraud Check", "my alias")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'my alias'");
        assertThat(catchThrowable(() -> Identities.requireAlias("a.b"))).isInstanceOf(IllegalArgumentException.class);
        assertThat(catchThrowable(() -> Identities.requireAlias("line\tbreak")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recognizesImplicitMarkerIdentities() {
        assertThat(Identities.isGlobalPseudoIdentity("initial")).isTrue();
        assertThat(Identities.isGlobalPseudoIdentity("[H*]")).isTrue();
        assertThat(Identities.isGlobalPseudoIdentity("Idle")).isFalse();
    }

    @Test
    void rejectsBlankNames() {
        Throwable thrown = catchThrowable(() -> Identities.requireName("  ", "state"));

        assertThat(thrown).isInstanceOf(EmptyNameException.class)
                .hasMessage("state name must not be blank");
    }

    @Test
    void stateIdentityFollowsAlias() {
        StateNode plain = StateNode.of("Waiting Room");
        StateNode aliased = new StateNode("Waiting Room", Optional.of("wr"), null, null, null);

        assertThat(plain.identity()).isEqualTo("Waiting_Room");
        assertThat(aliased.identity()).isEqualTo("wr");
    }

    @Test
    void notesOnLinksCannotBeAnchored() {
        Throwable thrown = catchThrowable(() -> new Note("text", NotePosition.ON_LINK, Optional.of("Idle")));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("on link");
    }
}
