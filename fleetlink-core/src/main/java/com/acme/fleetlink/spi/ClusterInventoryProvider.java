package com.acme.fleetlink.spi;

import com.acme.fleetlink.message.ClusterNode;
import java.util.List;

/** Source of the node inventory of the cluster the dispatcher runs in. */
public interface ClusterInventoryProvider {
  List<ClusterNode> listNodes();
}
