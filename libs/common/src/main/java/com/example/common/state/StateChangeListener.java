package com.example.common.state;

@FunctionalInterface
public interface StateChangeListener {

  /** 論理キー名を受け取る。値は受け取らず、必要なら再読込する。 */
  void onChange(String keyName);
}
