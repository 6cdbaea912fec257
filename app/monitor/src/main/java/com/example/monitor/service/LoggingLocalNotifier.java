package com.example.monitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingLocalNotifier implements LocalNotifier {

  private static final Logger logger = LoggerFactory.getLogger(LoggingLocalNotifier.class);

  @Override
  public void notify(String notificationId, String title, String body) {
    logger.warn("local notification id={} title={} body={}", notificationId, title, body);
  }
}
