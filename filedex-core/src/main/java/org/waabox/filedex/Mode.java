package org.waabox.filedex;

/**
 * How the catalog is deployed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Mode {

  /** A single node; the meta store also coordinates. */
  LOCAL,

  /** Many nodes sharing a distributed meta store and a coordinator. */
  CLUSTER
}
