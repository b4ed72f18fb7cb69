/**
 * Descriptor model: the typed, immutable representation of a router's
 * device and service descriptors.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tr064.domain.model.DeviceDescription} - One parsed descriptor document</li>
 *   <li>{@link fr.lapetina.tr064.domain.model.Device} - Device tree node with services and sub-devices</li>
 *   <li>{@link fr.lapetina.tr064.domain.model.Service} - Addressable group of actions plus its state-variable table</li>
 *   <li>{@link fr.lapetina.tr064.domain.model.Action} - Remote action with ordered arguments</li>
 *   <li>{@link fr.lapetina.tr064.domain.model.StateVariable} - Type definition shared by arguments</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All types are records holding unmodifiable collections. A discovered
 * schema is safe for concurrent readers.
 */
package fr.lapetina.tr064.domain.model;
