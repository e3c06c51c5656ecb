/**
 * Threading helpers for the dispatcher.
 */
package eventbus.util;
