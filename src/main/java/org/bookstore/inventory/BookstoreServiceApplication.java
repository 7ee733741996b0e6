package org.bookstore.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookstoreServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(BookstoreServiceApplication.class, args);
  }
}
