package com.tomaszrup.armls;

/**
 * Shared constants for custom extension↔server protocol messages.
 */
public final class Protocol {

	private Protocol() {
	}

	/**
	 * Custom protocol contract version between the editor extension and server.
	 */
	public static final String VERSION = "1";

	public static final String REQUEST_GET_RESOURCE_GRAPH = "armTemplate/getResourceGraph";
	public static final String REQUEST_GET_PROTOCOL_VERSION = "armTemplate/getProtocolVersion";
}
