/**
 * Dead letter tooling for querying, counting and replaying entries that stream destinations
 * gave up on.
 *
 * @see eventnative.dead.DeadLetterManager
 * @see eventnative.queue.PersistentQueue#replayDeadLetters()
 */
package eventnative.dead;
