package temporal.expansion;

/** Size counters of one expansion graph. */
public record ExpansionSummary(int numNodes, int numBlackEdges, int numRedEdges) {}
