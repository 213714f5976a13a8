package uk.gegc.imagestudio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImageStudioApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageStudioApplication.class, args);
    }
}
