package ru.oparin.imagepig;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImagePigApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImagePigApplication.class, args);
    }
}
