package com.example.storefront.application.port.in;

import com.example.storefront.domain.model.Category;
import com.example.storefront.domain.model.Money;
import com.example.storefront.domain.model.Product;
import com.example.storefront.domain.model.ProductId;
import com.example.storefront.domain.model.Review;
import com.example.storefront.domain.model.UserId;

import java.util.List;

/**
 * Inbound port for catalog maintenance and product search.
 */
public interface CatalogUseCase {

    Category registerCategory(String name, String description, String parentCategoryId);

    Product registerProduct(ProductId productId, String name, String description, Money price,
                            String categoryId, int initialStock);

    int restock(ProductId productId, int quantity);

    Product changePrice(ProductId productId, Money price);

    Product deactivate(ProductId productId);

    Product addSpecification(ProductId productId, String key, String value);

    /**
     * Attaches a customer review to a product. Ratings outside 1..5 are clamped.
     */
    Review addReview(ProductId productId, UserId userId, int rating, String comment);

    Product getProduct(ProductId productId);

    /**
     * Case-insensitive substring search over active products.
     *
     * @param query      text matched against name and description
     * @param categoryId restricts results to this category and its subcategories, may be null
     */
    List<Product> search(String query, String categoryId);

    int availableQuantity(ProductId productId);
}
