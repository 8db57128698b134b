package avatar.tools.graph;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DependencyGraphTest {

    @Test
    void reverseIndexFollowsEveryInsertion() {
        final DependencyGraph graph = new DependencyGraph(Map.of());

        graph.addEdge("main.c", "include/io.h");
        assertThat(graph.reverse()).isEqualTo(Map.of("include/io.h", Set.of("main.c")));

        graph.addEdge("io/io.c", "include/io.h");
        graph.addEdge("main.c", "include/timer.h");
        assertThat(graph.dependentsOf("include/io.h")).containsExactly("main.c", "io/io.c");
        assertThat(graph.dependenciesOf("main.c")).containsExactly("include/io.h", "include/timer.h");
        assertThat(GraphAssertions.transpose(graph.forward())).isEqualTo(graph.reverse());
    }

    @Test
    void selfEdgesAreRejected() {
        final DependencyGraph graph = new DependencyGraph(Map.of());

        assertThat(graph.addEdge("io.h", "io.h")).isFalse();
        assertThat(graph.forward()).isEmpty();
        assertThat(graph.reverse()).isEmpty();
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    void duplicateEdgesAreStoredOnce() {
        final DependencyGraph graph = new DependencyGraph(Map.of());

        assertThat(graph.addEdge("a.c", "b.h")).isTrue();
        assertThat(graph.addEdge("a.c", "b.h")).isFalse();
        assertThat(graph.edgeCount()).isEqualTo(1);
    }

    @Test
    void viewsAreReadOnly() {
        final DependencyGraph graph = new DependencyGraph(Map.of());
        graph.addEdge("a.c", "b.h");

        assertThatThrownBy(() -> graph.forward().get("a.c").add("c.h"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> graph.dependentsOf("b.h").clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(graph.dependenciesOf("unknown.c")).isEmpty();
    }
}
