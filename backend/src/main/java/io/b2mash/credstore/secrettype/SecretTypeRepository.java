package io.b2mash.credstore.secrettype;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SecretTypeRepository extends JpaRepository<SecretType, String> {

  List<SecretType> findAllByOrderByIdAsc();
}
