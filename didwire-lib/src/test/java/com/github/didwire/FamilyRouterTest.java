// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageType;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FamilyRouterTest {

  static class RecordingModule extends TypeRouter {
    final List<Message> seen = new ArrayList<>();

    RecordingModule(String familyId, String... names) {
      super(familyId);
      for (String name : names) {
        register(name, message -> {
          seen.add(message);
          return Optional.of(Message.ofType(familyId + "/" + name + "_reply"));
        });
      }
    }
  }

  @Property(tries = 50)
  void registeredHandlerRunsExactlyOnce(@ForAll @AlphaChars @StringLength(min = 1, max = 12) String name) {
    FamilyRouter router = new FamilyRouter();
    String family = MessageType.familyId("test", "1.0");
    RecordingModule module = new RecordingModule(family, name);
    router.register(module);

    RouteResult result = router.route(Message.ofType(family + "/" + name));

    assertThat(result).isInstanceOfSatisfying(RouteResult.Handled.class,
        h -> assertThat(h.reply()).hasValueSatisfying(r -> assertThat(r.type()).endsWith(name + "_reply")));
    assertThat(module.seen).hasSize(1);
  }

  @Test
  void unknownFamilyInvokesNothing() {
    FamilyRouter router = new FamilyRouter();
    RecordingModule module = new RecordingModule(MessageType.familyId("test", "1.0"), "a");
    router.register(module);

    RouteResult result = router.route(Message.ofType(MessageType.familyId("other", "1.0") + "/a"));

    assertThat(result).isEqualTo(new RouteResult.Unroutable(MessageType.familyId("other", "1.0") + "/a",
        FamilyRouter.TOP_LEVEL));
    assertThat(module.seen).isEmpty();
  }

  @Test
  void unknownTypeIsUnroutableInItsModule() {
    FamilyRouter router = new FamilyRouter();
    String family = MessageType.familyId("test", "1.0");
    RecordingModule module = new RecordingModule(family, "a");
    router.register(module);

    RouteResult result = router.route(Message.ofType(family + "/b"));

    assertThat(result).isInstanceOfSatisfying(RouteResult.Unroutable.class, u -> {
      assertThat(u.scope()).isEqualTo(family);
      assertThat(u.kind()).isEqualTo(ErrorKind.UNROUTABLE_MESSAGE);
    });
    assertThat(module.seen).isEmpty();
  }

  @Test
  void longestPrefixOnAPathBoundaryWins() {
    FamilyRouter router = new FamilyRouter();
    RecordingModule general = new RecordingModule("did:example;spec/fam", "1.0/x");
    RecordingModule specific = new RecordingModule("did:example;spec/fam/1.0", "x");
    RecordingModule lookalike = new RecordingModule("did:example;spec/fam/1", "01/x");
    router.register(general);
    router.register(specific);
    router.register(lookalike);

    router.route(Message.ofType("did:example;spec/fam/1.0/x"));
    router.route(Message.ofType("did:example;spec/fam/1/01/x"));

    assertThat(specific.seen).hasSize(1);
    assertThat(lookalike.seen).hasSize(1);
    assertThat(general.seen).isEmpty();
    assertThat(router.moduleFor("did:example;spec/fam/1.01/x")).contains(general);
  }

  @Test
  void duplicatesAreRejected() {
    FamilyRouter router = new FamilyRouter();
    String family = MessageType.familyId("test", "1.0");
    router.register(new RecordingModule(family, "a"));

    assertThatThrownBy(() -> router.register(new RecordingModule(family, "b")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RecordingModule(family, "a", "a"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(router.modules()).containsOnlyKeys(family);
  }

  @Test
  void messageWithoutTypeIsUnroutable() {
    FamilyRouter router = new FamilyRouter();
    router.register(new RecordingModule(MessageType.familyId("test", "1.0"), "a"));

    assertThat(router.route(new Message(Map.of("x", 1)))).isInstanceOf(RouteResult.Unroutable.class);
  }
}
