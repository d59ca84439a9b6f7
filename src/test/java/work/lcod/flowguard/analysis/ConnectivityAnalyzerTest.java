package work.lcod.flowguard.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.flowguard.support.FlowFixtures.MANUAL_TRIGGER;
import static work.lcod.flowguard.support.FlowFixtures.SET;
import static work.lcod.flowguard.support.FlowFixtures.graph;
import static work.lcod.flowguard.support.FlowFixtures.step;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.flowguard.graph.Edge;
import work.lcod.flowguard.graph.PortKind;
import work.lcod.flowguard.graph.Position;
import work.lcod.flowguard.graph.Step;
import work.lcod.flowguard.support.FlowFixtures;

class ConnectivityAnalyzerTest {
    private final ConnectivityAnalyzer analyzer = new ConnectivityAnalyzer(FlowFixtures.policy());

    @Test
    void depthFollowsLongestMainPathFromTrigger() {
        var graph = graph(step("Start", MANUAL_TRIGGER), step("A", SET), step("B", SET), step("C", SET));
        graph.addEdge(Edge.main("Start", "A"));
        graph.addEdge(Edge.main("A", "B"));
        graph.addEdge(Edge.main("B", "C"));
        graph.addEdge(Edge.main("Start", "C"));

        assertEquals(3, analyzer.depth(graph));
    }

    @Test
    void depthIsZeroWithoutTrigger() {
        var graph = graph(step("A", SET), step("B", SET));
        graph.addEdge(Edge.main("A", "B"));

        assertEquals(0, analyzer.depth(graph));
    }

    @Test
    void cyclesTerminateWithinStepCount() {
        var graph = graph(step("Start", MANUAL_TRIGGER), step("A", SET), step("B", SET));
        graph.addEdge(Edge.main("Start", "A"));
        graph.addEdge(Edge.main("A", "B"));
        graph.addEdge(Edge.main("B", "A"));

        assertEquals(2, analyzer.depth(graph));
    }

    @Test
    void depthIgnoresEdgesToUnknownSteps() {
        var graph = graph(step("Start", MANUAL_TRIGGER), step("A", SET));
        graph.addEdge(Edge.main("Start", "A"));
        graph.addEdge(Edge.main("A", "Ghost"));

        assertEquals(1, analyzer.depth(graph));
    }

    @Test
    void maxFanoutCountsEdgesPerSlot() {
        var graph = graph(step("A", SET), step("B", SET), step("C", SET), step("D", SET));
        graph.addEdge(Edge.main("A", "B")).addEdge(Edge.main("A", "C"));
        graph.addEdge(new Edge("A", PortKind.MAIN, 1, "D", 0));

        assertEquals(2, analyzer.maxFanout(graph));
        assertEquals(0, analyzer.maxFanout(graph(step("Lonely", SET))));
    }

    @Test
    void orphansIncludeUnnamedSteps() {
        var unnamed = new Step(null, SET, new Position(0, 0), null);
        var graph = graph(step("A", SET), step("B", SET), step("Island", SET), unnamed);
        graph.addEdge(Edge.main("A", "B"));

        assertEquals(List.of(graph.steps().get(2), unnamed), analyzer.orphans(graph));
    }

    @Test
    void summaryCollectsAllFigures() {
        var graph = FlowFixtures.load("fanout-chain.json");

        var summary = analyzer.summary(graph);

        assertEquals(10, summary.stepCount());
        assertEquals(10, summary.edgeCount());
        assertEquals(2, summary.maxFanout());
        assertEquals(List.of(), summary.orphans());
        var map = summary.toSerializableMap();
        assertEquals(List.of("steps", "edges", "depth", "maxFanout", "orphans"), List.copyOf(map.keySet()));
    }
}
