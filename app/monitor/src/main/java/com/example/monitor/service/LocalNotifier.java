package com.example.monitor.service;

/** agent から利用者へ送るローカル通知。同じ id の通知は置き換えとして扱われる。 */
public interface LocalNotifier {

  void notify(String notificationId, String title, String body);
}
