package org.distgo.base.uct;

/**
 * Source of prior estimates for freshly expanded nodes.  The heuristics themselves live with the local search.
 */
public interface PriorEstimator
{
  /**
   * Fill in the prior for every considered move.
   *
   * @param xiNode - the node being expanded.
   * @param xiMap  - the map to fill in.
   */
  public void estimate(TreeNode xiNode, PriorMap xiMap);
}
