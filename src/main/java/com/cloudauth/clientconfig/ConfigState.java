package com.cloudauth.clientconfig;

/**
 * Whether a client configuration record currently exists.
 */
public enum ConfigState {
  UNCONFIGURED,
  CONFIGURED
}
