package com.example.workbookmerge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkbookMergeApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkbookMergeApplication.class, args);
    }
}
