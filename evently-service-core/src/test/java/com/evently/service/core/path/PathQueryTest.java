package com.evently.service.core.path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PathQueryTest {

    private final Map<String, Object> doc = document();

    private static Map<String, Object> document() {
        Map<String, Object> imageMeta = new LinkedHashMap<>();
        imageMeta.put("disk_gb", "20");
        imageMeta.put("org.openstack__1__architecture", "x86_64");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("instance_id", "id-for-instance-0001");
        payload.put("instance_uuid", "uuid-for-instance-0001");
        payload.put("instance_id2", null);
        payload.put("host", "host-1-2-3");
        payload.put("image_meta", imageMeta);
        payload.put("fixed_ips", List.of(Map.of("address", "10.0.0.2"), Map.of("address", "10.0.0.3")));
        payload.put("foobar", 50);

        Map<String, Object> root = new HashMap<>();
        root.put("event_type", "test.thing");
        root.put("payload", payload);
        return root;
    }

    @Test
    void dottedPath() {
        assertThat(PathQuery.compile("payload.instance_id").evaluate(doc)).containsExactly("id-for-instance-0001");
    }

    @Test
    void bracketedAndRootedPaths() {
        assertThat(PathQuery.compile("payload[host]").evaluate(doc)).containsExactly("host-1-2-3");
        assertThat(PathQuery.compile("$.payload.host").evaluate(doc)).containsExactly("host-1-2-3");
        assertThat(PathQuery.compile("payload['image_meta'][\"disk_gb\"]").evaluate(doc))
                .containsExactly("20");
    }

    @Test
    void quotedKeyWithDots() {
        PathQuery q = PathQuery.compile("payload.image_meta.'org.openstack__1__architecture'");
        assertThat(q.evaluate(doc)).containsExactly("x86_64");
    }

    @Test
    void sequenceIndexAndWildcard() {
        assertThat(PathQuery.compile("payload.fixed_ips[1].address").evaluate(doc)).containsExactly("10.0.0.3");
        assertThat(PathQuery.compile("payload.fixed_ips[*].address").evaluate(doc))
                .containsExactly("10.0.0.2", "10.0.0.3");
        assertThat(PathQuery.compile("payload.image_meta.*").evaluate(doc)).containsExactly("20", "x86_64");
        assertThat(PathQuery.compile("payload.fixed_ips[5].address").evaluate(doc)).isEmpty();
    }

    @Test
    void missingIntermediateKeysYieldNothing() {
        assertThat(PathQuery.compile("payload.not_here_boss.deeper").evaluate(doc)).isEmpty();
        assertThat(PathQuery.compile("payload.host.deeper").evaluate(doc)).isEmpty();
        assertThat(PathQuery.compile("payload.fixed_ips.address").evaluate(doc)).isEmpty();
    }

    @Test
    void nullValuesAreAbsent() {
        assertThat(PathQuery.compile("payload.instance_id2").evaluate(doc)).isEmpty();
        assertThat(PathQuery.compile("payload.instance_id2").first(doc)).isEmpty();
    }

    @Test
    void unionKeepsDeclaredOrder() {
        PathQuery q = PathQuery.compile(List.of("payload.instance_uuid", "payload.instance_id"));
        assertThat(q.evaluate(doc)).containsExactly("uuid-for-instance-0001", "id-for-instance-0001");
        assertThat(q.first(doc)).contains("uuid-for-instance-0001");

        PathQuery reversed = PathQuery.compile(List.of("payload.instance_id", "payload.instance_uuid"));
        assertThat(reversed.first(doc)).contains("id-for-instance-0001");
    }

    @Test
    void firstSkipsMissingAndNullAlternatives() {
        PathQuery q = PathQuery.compile(List.of("payload.not_here_boss", "payload.instance_id2", "payload.foobar"));
        assertThat(q.first(doc)).contains(50);
        assertThat(q.alternativeCount()).isEqualTo(3);
    }

    @Test
    void pipeUnionInsideOneExpression() {
        PathQuery grouped = PathQuery.compile("(payload.instance_id2)|(payload.host)");
        PathQuery plain = PathQuery.compile("payload.not_here | payload.host");

        assertThat(grouped.alternativeCount()).isEqualTo(2);
        assertThat(grouped.first(doc)).contains("host-1-2-3");
        assertThat(plain.first(doc)).contains("host-1-2-3");
    }

    @Test
    void rootOnlySelectsDocument() {
        assertThat(PathQuery.compile("$").evaluate(doc)).containsExactly(doc);
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThatThrownBy(() -> PathQuery.compile("payload.bogus("))
                .isInstanceOf(PathSyntaxException.class)
                .satisfies(ex -> {
                    PathSyntaxException pse = (PathSyntaxException) ex;
                    assertThat(pse.getExpression()).isEqualTo("payload.bogus(");
                    assertThat(pse.getPosition()).isEqualTo(13);
                });
        assertThatThrownBy(() -> PathQuery.compile("payload.")).isInstanceOf(PathSyntaxException.class);
        assertThatThrownBy(() -> PathQuery.compile("payload['host")).isInstanceOf(PathSyntaxException.class);
        assertThatThrownBy(() -> PathQuery.compile("payload[host")).isInstanceOf(PathSyntaxException.class);
        assertThatThrownBy(() -> PathQuery.compile("(payload.host")).isInstanceOf(PathSyntaxException.class);
        assertThatThrownBy(() -> PathQuery.compile("  ")).isInstanceOf(PathSyntaxException.class);
        assertThatThrownBy(() -> PathQuery.compile(List.of())).isInstanceOf(PathSyntaxException.class);
    }

    @Test
    void describesItself() {
        assertThat(PathQuery.compile(List.of("payload.fixed_ips[0].address", "payload.host")))
                .hasToString("$.'payload'.'fixed_ips'[0].'address'|$.'payload'.'host'");
    }
}
