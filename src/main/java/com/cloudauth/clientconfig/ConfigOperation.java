package com.cloudauth.clientconfig;

public enum ConfigOperation {
  CREATE,
  UPDATE,
  READ,
  DELETE
}
