/**
 * File-backed durable queue of stream-mode destinations.
 *
 * <h2>On-disk layout</h2>
 * <pre>
 * &lt;log dir&gt;/queue.dst=&lt;destination&gt;/
 *   .lock            directory lock, one owner per directory
 *   segment-1.log    [int length][int crc32][json entry] records
 *   segment-2.log
 *   cursor           resolved position: [long segment][long offset][int crc32]
 *   dead.log         dead letters, same record layout
 * </pre>
 *
 * @see eventnative.queue.PersistentQueue
 */
package eventnative.queue;
