package com.example.common.state;

public interface StateSubscription extends AutoCloseable {

  @Override
  void close();
}
