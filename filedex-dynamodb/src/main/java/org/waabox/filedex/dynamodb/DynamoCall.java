package org.waabox.filedex.dynamodb;

/**
 * A DynamoDB client call.
 *
 * @param <T> the call result
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
interface DynamoCall<T> {

  /**
   * Runs the call.
   *
   * @return the result, may be null
   */
  T run();
}
