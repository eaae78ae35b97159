/**
 * Spring Boot auto-configuration for destinations configured under {@code eventnative.*}.
 *
 * @see eventnative.spring.boot.EventNativeAutoConfiguration
 */
package eventnative.spring.boot;
